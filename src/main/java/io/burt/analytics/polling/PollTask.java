package io.burt.analytics.polling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * One polling run. The same instance is resubmitted to its executor after
 * each invocation that satisfies the stop condition, so invocations never
 * overlap.
 */
class PollTask<R> implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(PollTask.class);

    private final Probe<R> probe;
    private final Predicate<R> stopCondition;
    private final Consumer<R> onStop;
    private final IterationBudget budget;
    private final Backoff backoff;
    private final ScheduledExecutorService executor;
    private final FaultReporter faultReporter;
    private final WaitHandle<R> handle;

    private Duration currentDelay;

    PollTask(Probe<R> probe, Predicate<R> stopCondition, Consumer<R> onStop, IterationBudget budget, Duration stepDelay, Backoff backoff, ScheduledExecutorService executor, FaultReporter faultReporter) {
        this.probe = probe;
        this.stopCondition = stopCondition;
        this.onStop = onStop;
        this.budget = budget;
        this.backoff = backoff;
        this.executor = executor;
        this.faultReporter = faultReporter;
        this.handle = new WaitHandle<>();
        this.currentDelay = backoff.first(stepDelay);
    }

    WaitHandle<R> handle() {
        return handle;
    }

    void start(Duration initialDelay) {
        executor.schedule(this, WaitHandle.saturatedNanos(initialDelay), TimeUnit.NANOSECONDS);
    }

    @Override
    public void run() {
        try {
            R result;
            try {
                result = probe.poll();
            } finally {
                handle.recordInvocation();
            }
            if (budget.isExhaustedBy(handle.invocations())) {
                IterationBudgetExhaustedException exhausted = new IterationBudgetExhaustedException(budget.maxIterations());
                LOG.warn("{}: {}", Thread.currentThread().getName(), exhausted.getMessage());
                finish(exhausted);
            } else if (stopCondition.test(result)) {
                Duration delay = currentDelay;
                currentDelay = backoff.next(currentDelay);
                LOG.debug("{}: poll #{} did not stop, polling again in {}", Thread.currentThread().getName(), handle.invocations(), delay);
                executor.schedule(this, WaitHandle.saturatedNanos(delay), TimeUnit.NANOSECONDS);
            } else {
                onStop.accept(result);
                handle.resolve(result);
                executor.shutdown();
            }
        } catch (Throwable t) {
            // anything escaping run() only ends up in a ScheduledFuture nobody reads
            finish(t);
            faultReporter.report(Thread.currentThread().getName(), t);
            if (t instanceof Error) {
                throw (Error) t;
            }
        }
    }

    private void finish(Throwable fault) {
        handle.fail(fault);
        executor.shutdown();
    }
}
