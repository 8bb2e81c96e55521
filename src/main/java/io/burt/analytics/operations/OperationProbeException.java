package io.burt.analytics.operations;

public class OperationProbeException extends OperationException {
    public OperationProbeException(JobHandle jobHandle, Throwable cause) {
        super(String.format("Could not get the status of operation with OperationId '%s': %s", jobHandle, cause.getMessage()), jobHandle, cause);
    }
}
