package io.burt.analytics.polling;

import java.util.concurrent.TimeoutException;

public class IterationBudgetExhaustedException extends TimeoutException {
    private final long maxIterations;

    public IterationBudgetExhaustedException(long maxIterations) {
        super(String.format("Timed out based on maximal allowed repetitions (%d), aborting", maxIterations));
        this.maxIterations = maxIterations;
    }

    public long maxIterations() {
        return maxIterations;
    }
}
