package io.burt.analytics.polling;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The caller's side of a polling run started by
 * {@link BackoffScheduler#schedule}.
 *
 * A handle is resolved exactly once, either with the last probe result or
 * with the exception that ended the run. Later attempts to resolve it are
 * ignored.
 *
 * @param <R> the type of the probe results
 */
public class WaitHandle<R> {
    private final CompletableFuture<R> completion;
    private final AtomicLong invocations;

    WaitHandle() {
        this.completion = new CompletableFuture<>();
        this.invocations = new AtomicLong(0L);
    }

    long recordInvocation() {
        return invocations.incrementAndGet();
    }

    boolean resolve(R result) {
        return completion.complete(result);
    }

    boolean fail(Throwable fault) {
        return completion.completeExceptionally(fault);
    }

    /**
     * @return the number of times the probe has returned or thrown so far
     */
    public long invocations() {
        return invocations.get();
    }

    public boolean isResolved() {
        return completion.isDone();
    }

    /**
     * @return the exception that ended the run, or empty if the run has not
     *         ended or ended normally
     */
    public Optional<Throwable> failure() {
        if (completion.isCompletedExceptionally()) {
            try {
                completion.getNow(null);
            } catch (CompletionException e) {
                return Optional.of(e.getCause());
            }
        }
        return Optional.empty();
    }

    /**
     * Blocks until the run ends.
     *
     * @return the last probe result, the one that did not satisfy the stop
     *         condition
     * @throws ExecutionException when the run ended with an exception, which
     *                            is available as the cause
     * @throws InterruptedException when the calling thread is interrupted
     *                              while waiting
     */
    public R await() throws InterruptedException, ExecutionException {
        return completion.get();
    }

    /**
     * Blocks until the run ends or the timeout elapses, whichever happens
     * first.
     *
     * The run is not affected when the timeout elapses, it continues in the
     * background until its budget is exhausted or the stop condition no
     * longer holds.
     *
     * @param timeout the maximum time to wait
     * @return true if the run ended normally within the timeout, false if it
     *         had not ended when the timeout elapsed
     * @throws ExecutionException when the run ended with an exception within
     *                            the timeout
     * @throws InterruptedException when the calling thread is interrupted
     *                              while waiting
     */
    public boolean await(Duration timeout) throws InterruptedException, ExecutionException {
        try {
            completion.get(saturatedNanos(timeout), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException te) {
            return false;
        }
    }

    /**
     * Durations longer than about 292 years do not fit in a long number of
     * nanoseconds, and are treated as {@link Long#MAX_VALUE} nanoseconds.
     */
    static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    @Override
    public String toString() {
        return String.format("WaitHandle(resolved=%s, invocations=%d)", isResolved(), invocations());
    }
}
