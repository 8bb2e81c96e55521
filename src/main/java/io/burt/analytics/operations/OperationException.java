package io.burt.analytics.operations;

public class OperationException extends Exception {
    private final JobHandle jobHandle;

    public OperationException(String message, JobHandle jobHandle) {
        super(message);
        this.jobHandle = jobHandle;
    }

    public OperationException(String message, JobHandle jobHandle, Throwable cause) {
        super(message, cause);
        this.jobHandle = jobHandle;
    }

    public JobHandle jobHandle() {
        return jobHandle;
    }
}
