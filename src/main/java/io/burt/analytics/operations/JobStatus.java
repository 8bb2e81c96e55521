package io.burt.analytics.operations;

import java.util.Objects;

public final class JobStatus {
    private final JobState state;
    private final String statusDetail;
    private final String operationId;

    public JobStatus(JobState state, String statusDetail, String operationId) {
        this.state = Objects.requireNonNull(state, "state");
        this.statusDetail = statusDetail == null ? "" : statusDetail;
        this.operationId = Objects.requireNonNull(operationId, "operationId");
    }

    public JobState state() {
        return state;
    }

    public String statusDetail() {
        return statusDetail;
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
            JobStatus other = (JobStatus) o;
            return state == other.state && statusDetail.equals(other.statusDetail) && operationId.equals(other.operationId);
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, statusDetail, operationId);
    }

    @Override
    public String toString() {
        return String.format("JobStatus(operationId=%s, state=%s, statusDetail=%s)", operationId, state, statusDetail);
    }
}
