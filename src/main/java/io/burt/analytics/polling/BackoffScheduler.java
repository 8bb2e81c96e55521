package io.burt.analytics.polling;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Runs a probe repeatedly on a background thread, doubling the delay
 * between invocations up to {@link #MAX_DELAY}, for as long as the probe's
 * results satisfy a stop condition.
 *
 * Every call to {@link #schedule} starts an independent run with its own
 * single threaded executor, which is shut down when the run ends. Worker
 * threads are daemon threads, so a run that nobody waits for any more does
 * not keep the JVM alive.
 */
public class BackoffScheduler {
    public static final Duration MAX_DELAY = Duration.ofMinutes(1);

    private final String name;
    private final Backoff backoff;
    private final FaultReporter faultReporter;
    private final Supplier<ScheduledExecutorService> executorFactory;
    private final AtomicInteger threadCounter;

    public BackoffScheduler() {
        this("backoff-scheduler");
    }

    public BackoffScheduler(String name) {
        this(name, new LoggingFaultReporter());
    }

    public BackoffScheduler(String name, FaultReporter faultReporter) {
        this.name = name;
        this.backoff = new Backoff(MAX_DELAY);
        this.faultReporter = faultReporter;
        this.threadCounter = new AtomicInteger(0);
        this.executorFactory = () -> Executors.newSingleThreadScheduledExecutor(this::newThread);
    }

    BackoffScheduler(String name, FaultReporter faultReporter, Supplier<ScheduledExecutorService> executorFactory) {
        this.name = name;
        this.backoff = new Backoff(MAX_DELAY);
        this.faultReporter = faultReporter;
        this.threadCounter = new AtomicInteger(0);
        this.executorFactory = executorFactory;
    }

    private Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, String.format("%s-%d", name, threadCounter.incrementAndGet()));
        thread.setDaemon(true);
        return thread;
    }

    /**
     * Starts polling and returns immediately.
     *
     * The probe is first invoked after the initial delay. After each
     * invocation the run ends with an {@link IterationBudgetExhaustedException}
     * if the budget has been used up. Otherwise, if the stop condition is not
     * satisfied by the result, the run ends by passing the result to
     * <code>onStop</code>. If it is satisfied the probe is invoked again after
     * the current delay, which starts at <code>stepDelay</code> and doubles
     * after every invocation until it reaches {@link #MAX_DELAY}.
     *
     * An exception thrown by the probe ends the run immediately, without
     * calling <code>onStop</code>. The exception fails the returned handle
     * and is passed to this scheduler's {@link FaultReporter}.
     *
     * @param probe the function to invoke, never concurrently with itself
     * @param initialDelay the delay before the first invocation
     * @param stepDelay the delay between the first and second invocation
     * @param budget the maximum number of invocations
     * @param stopCondition true if polling should continue after the given result
     * @param onStop receives the last result, on the polling thread, when
     *               the stop condition is no longer satisfied
     * @param <R> the type of the probe results
     * @return a handle that can be used to wait for the run to end
     */
    public <R> WaitHandle<R> schedule(Probe<R> probe, Duration initialDelay, Duration stepDelay, IterationBudget budget, Predicate<R> stopCondition, Consumer<R> onStop) {
        Objects.requireNonNull(probe, "probe");
        Objects.requireNonNull(budget, "budget");
        Objects.requireNonNull(stopCondition, "stopCondition");
        Objects.requireNonNull(onStop, "onStop");
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException(String.format("Initial delay must not be negative, got %s", initialDelay));
        }
        if (stepDelay.isNegative()) {
            throw new IllegalArgumentException(String.format("Step delay must not be negative, got %s", stepDelay));
        }
        PollTask<R> task = new PollTask<>(probe, stopCondition, onStop, budget, stepDelay, backoff, executorFactory.get(), faultReporter);
        task.start(initialDelay);
        return task.handle();
    }
}
