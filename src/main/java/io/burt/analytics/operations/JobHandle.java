package io.burt.analytics.operations;

import java.util.Objects;

/**
 * Identifies a remote operation that was started asynchronously.
 */
public final class JobHandle {
    private final String operationId;

    private JobHandle(String operationId) {
        this.operationId = operationId;
    }

    public static JobHandle of(String operationId) {
        Objects.requireNonNull(operationId, "operationId");
        if (operationId.isEmpty()) {
            throw new IllegalArgumentException("Operation ID must not be empty");
        }
        return new JobHandle(operationId);
    }

    public String operationId() {
        return operationId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o == null || getClass() != o.getClass()) {
            return false;
        } else {
            return operationId.equals(((JobHandle) o).operationId);
        }
    }

    @Override
    public int hashCode() {
        return operationId.hashCode();
    }

    @Override
    public String toString() {
        return operationId;
    }
}
