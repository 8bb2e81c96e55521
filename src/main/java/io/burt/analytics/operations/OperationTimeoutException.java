package io.burt.analytics.operations;

public class OperationTimeoutException extends OperationException {
    public enum Reason {
        OVERALL_TIMEOUT,
        ITERATION_BUDGET_EXHAUSTED
    }

    private final Reason reason;

    public OperationTimeoutException(JobHandle jobHandle, Reason reason) {
        super(String.format("Timed out while waiting for operation with OperationId '%s'", jobHandle), jobHandle);
        this.reason = reason;
    }

    public OperationTimeoutException(JobHandle jobHandle, Reason reason, Throwable cause) {
        super(String.format("Timed out while waiting for operation with OperationId '%s'", jobHandle), jobHandle, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
