package io.burt.analytics.operations;

public class OperationFailedException extends OperationException {
    private final JobStatus status;

    public OperationFailedException(JobHandle jobHandle, JobStatus status) {
        super(String.format("Failed to execute operation with OperationId '%s', State: '%s', Status: '%s'", status.operationId(), status.state(), status.statusDetail()), jobHandle);
        this.status = status;
    }

    public JobStatus status() {
        return status;
    }
}
