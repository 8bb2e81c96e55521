package io.burt.analytics.polling;

import java.time.Duration;

public class Backoff {
    private final Duration maxDelay;
    private final long factor;

    public Backoff(Duration maxDelay) {
        this(maxDelay, 2L);
    }

    public Backoff(Duration maxDelay, long factor) {
        if (maxDelay.isNegative()) {
            throw new IllegalArgumentException(String.format("Max delay must not be negative, got %s", maxDelay));
        }
        if (factor < 1) {
            throw new IllegalArgumentException(String.format("Backoff factor must be at least 1, got %d", factor));
        }
        this.maxDelay = maxDelay;
        this.factor = factor;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    /**
     * Returns the delay to use first, which is the desired delay limited to
     * the max delay.
     */
    public Duration first(Duration desired) {
        return limit(desired);
    }

    /**
     * Returns the delay that follows the given one, growing by the factor
     * and never exceeding the max delay.
     */
    public Duration next(Duration current) {
        if (current.compareTo(maxDelay) >= 0) {
            return maxDelay;
        } else {
            return limit(current.multipliedBy(factor));
        }
    }

    private Duration limit(Duration delay) {
        if (delay.compareTo(maxDelay) > 0) {
            return maxDelay;
        } else {
            return delay;
        }
    }
}
