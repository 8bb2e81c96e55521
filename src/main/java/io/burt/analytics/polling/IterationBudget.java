package io.burt.analytics.polling;

import java.util.Objects;

/**
 * The number of times a {@link BackoffScheduler} may invoke a probe.
 *
 * A budget is either bounded, in which case the run fails with an
 * {@link IterationBudgetExhaustedException} on its last allowed invocation,
 * or unbounded, in which case only the stop condition ends the run.
 */
public final class IterationBudget {
    private static final IterationBudget UNBOUNDED = new IterationBudget(0L, false);

    private final long maxIterations;
    private final boolean bounded;

    private IterationBudget(long maxIterations, boolean bounded) {
        this.maxIterations = maxIterations;
        this.bounded = bounded;
    }

    public static IterationBudget of(long maxIterations) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException(String.format("Iteration budget must be positive, got %d", maxIterations));
        }
        return new IterationBudget(maxIterations, true);
    }

    public static IterationBudget unbounded() {
        return UNBOUNDED;
    }

    public boolean isBounded() {
        return bounded;
    }

    public long maxIterations() {
        if (!bounded) {
            throw new IllegalStateException("An unbounded budget has no maximum");
        }
        return maxIterations;
    }

    boolean isExhaustedBy(long invocations) {
        return bounded && invocations >= maxIterations;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o == null || getClass() != o.getClass()) {
            return false;
        } else {
            IterationBudget other = (IterationBudget) o;
            return maxIterations == other.maxIterations && bounded == other.bounded;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxIterations, bounded);
    }

    @Override
    public String toString() {
        return bounded ? String.format("IterationBudget(%d)", maxIterations) : "IterationBudget(unbounded)";
    }
}
