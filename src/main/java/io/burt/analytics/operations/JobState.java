package io.burt.analytics.operations;

public enum JobState {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    UNKNOWN;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
