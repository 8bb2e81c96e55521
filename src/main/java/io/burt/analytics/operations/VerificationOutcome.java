package io.burt.analytics.operations;

import java.util.Optional;

/**
 * What the verifier knows about an operation once it stops waiting for it.
 */
public final class VerificationOutcome {
    private final boolean resolved;
    private final boolean timedOut;
    private final JobStatus lastStatus;
    private final Throwable failure;

    private VerificationOutcome(boolean resolved, boolean timedOut, JobStatus lastStatus, Throwable failure) {
        this.resolved = resolved;
        this.timedOut = timedOut;
        this.lastStatus = lastStatus;
        this.failure = failure;
    }

    static VerificationOutcome resolved(JobStatus lastStatus) {
        return new VerificationOutcome(true, false, lastStatus, null);
    }

    static VerificationOutcome timedOut(JobStatus lastStatus) {
        return new VerificationOutcome(false, true, lastStatus, null);
    }

    static VerificationOutcome failed(Throwable failure, JobStatus lastStatus) {
        return new VerificationOutcome(true, false, lastStatus, failure);
    }

    public boolean isResolved() {
        return resolved;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public Optional<JobStatus> lastStatus() {
        return Optional.ofNullable(lastStatus);
    }

    /**
     * @return the exception that ended polling, when polling did not end
     *         with a status that stopped it
     */
    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure);
    }

    public boolean isSuccessful() {
        return resolved && !timedOut && failure == null && lastStatus != null && lastStatus.state() == JobState.COMPLETED;
    }

    @Override
    public String toString() {
        return String.format("VerificationOutcome(resolved=%s, timedOut=%s, lastStatus=%s, failure=%s)", resolved, timedOut, lastStatus, failure);
    }
}
