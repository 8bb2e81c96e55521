package io.burt.analytics.operations;

import io.burt.analytics.polling.BackoffScheduler;
import io.burt.analytics.polling.IterationBudget;
import io.burt.analytics.polling.IterationBudgetExhaustedException;
import io.burt.analytics.polling.WaitHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Waits for asynchronously started remote operations to finish.
 *
 * The status of the operation is polled with a {@link BackoffScheduler}
 * for as long as it is reported as {@link JobState#IN_PROGRESS}. Any other
 * state ends polling, and unless that state is {@link JobState#COMPLETED}
 * verification fails.
 */
public class OperationCompletionVerifier {
    private static final Logger LOG = LoggerFactory.getLogger(OperationCompletionVerifier.class);

    static final long ITERATION_MARGIN = 5L;
    static final Duration MIN_SAMPLE_PERIOD = Duration.ofMillis(1);

    private final BackoffScheduler scheduler;

    public OperationCompletionVerifier() {
        this(new BackoffScheduler("operation-completion"));
    }

    public OperationCompletionVerifier(BackoffScheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Blocks until the operation has completed.
     *
     * @param statusQuery fetches the status of the operation
     * @param jobHandle the operation to wait for
     * @param samplePeriod the delay between the first two status checks,
     *                     later delays grow exponentially
     * @param overallTimeout the maximum time to wait
     * @throws OperationFailedException when the operation ends in any state
     *                                  other than completed
     * @throws OperationTimeoutException when the operation has not ended
     *                                   within the timeout
     * @throws OperationProbeException when the status could not be fetched
     * @throws InterruptedException when the calling thread is interrupted
     *                              while waiting
     */
    public void verify(StatusQuery statusQuery, JobHandle jobHandle, Duration samplePeriod, Duration overallTimeout) throws OperationException, InterruptedException {
        Objects.requireNonNull(overallTimeout, "overallTimeout");
        if (overallTimeout.isNegative()) {
            throw new IllegalArgumentException(String.format("Timeout must not be negative, got %s", overallTimeout));
        }
        raiseUnlessSuccessful(jobHandle, awaitOutcome(statusQuery, jobHandle, samplePeriod, Optional.of(overallTimeout)));
    }

    /**
     * Blocks until the operation has completed, however long that takes.
     *
     * This will never return if the operation stays in progress forever.
     *
     * @see #verify(StatusQuery, JobHandle, Duration, Duration)
     */
    public void verifyWithoutTimeout(StatusQuery statusQuery, JobHandle jobHandle, Duration samplePeriod) throws OperationException, InterruptedException {
        raiseUnlessSuccessful(jobHandle, awaitOutcome(statusQuery, jobHandle, samplePeriod, Optional.empty()));
    }

    VerificationOutcome awaitOutcome(StatusQuery statusQuery, JobHandle jobHandle, Duration samplePeriod, Optional<Duration> overallTimeout) throws InterruptedException {
        Objects.requireNonNull(statusQuery, "statusQuery");
        Objects.requireNonNull(jobHandle, "jobHandle");
        Duration period = effectiveSamplePeriod(samplePeriod);
        IterationBudget budget = overallTimeout.map(timeout -> iterationBudget(period, timeout)).orElse(IterationBudget.unbounded());
        AtomicReference<JobStatus> lastStatus = new AtomicReference<>();
        LOG.debug("Waiting for operation {} (sample period {}, timeout {}, {})", jobHandle, period, overallTimeout.map(Duration::toString).orElse("none"), budget);
        WaitHandle<JobStatus> handle = scheduler.schedule(
                () -> fetchStatus(statusQuery, jobHandle),
                Duration.ZERO,
                period,
                budget,
                status -> status.state() == JobState.IN_PROGRESS,
                lastStatus::set
        );
        try {
            if (overallTimeout.isPresent()) {
                if (!handle.await(overallTimeout.get())) {
                    return VerificationOutcome.timedOut(lastStatus.get());
                }
            } else {
                handle.await();
            }
        } catch (ExecutionException ee) {
            return VerificationOutcome.failed(ee.getCause(), lastStatus.get());
        }
        return VerificationOutcome.resolved(lastStatus.get());
    }

    private JobStatus fetchStatus(StatusQuery statusQuery, JobHandle jobHandle) throws Exception {
        JobStatus status = statusQuery.fetch(jobHandle);
        if (status == null) {
            throw new IllegalStateException(String.format("No status returned for operation with OperationId '%s'", jobHandle));
        }
        LOG.debug("Operation {} is {}", jobHandle, status.state());
        return status;
    }

    private void raiseUnlessSuccessful(JobHandle jobHandle, VerificationOutcome outcome) throws OperationException {
        if (outcome.isTimedOut()) {
            LOG.warn("Timed out while waiting for operation {}", jobHandle);
            throw new OperationTimeoutException(jobHandle, OperationTimeoutException.Reason.OVERALL_TIMEOUT);
        }
        Optional<Throwable> failure = outcome.failure();
        if (failure.isPresent()) {
            if (failure.get() instanceof IterationBudgetExhaustedException) {
                LOG.warn("Gave up waiting for operation {}: {}", jobHandle, failure.get().getMessage());
                throw new OperationTimeoutException(jobHandle, OperationTimeoutException.Reason.ITERATION_BUDGET_EXHAUSTED, failure.get());
            } else {
                throw new OperationProbeException(jobHandle, failure.get());
            }
        }
        JobStatus status = outcome.lastStatus().orElseThrow(() -> new IllegalStateException(String.format("Polling of operation %s ended without a status", jobHandle)));
        if (status.state() != JobState.COMPLETED) {
            if (status.state().isTerminal()) {
                LOG.warn("Operation {} ended in state {}: {}", jobHandle, status.state(), status.statusDetail());
            } else {
                LOG.warn("Polling of operation {} stopped in non-terminal state {}: {}", jobHandle, status.state(), status.statusDetail());
            }
            throw new OperationFailedException(jobHandle, status);
        }
        LOG.info("Operation {} completed", jobHandle);
    }

    static Duration effectiveSamplePeriod(Duration samplePeriod) {
        Objects.requireNonNull(samplePeriod, "samplePeriod");
        if (samplePeriod.compareTo(MIN_SAMPLE_PERIOD) < 0) {
            return MIN_SAMPLE_PERIOD;
        } else {
            return samplePeriod;
        }
    }

    /**
     * The number of status checks that fit into the timeout, plus a margin
     * so that the budget does not run out before the timeout does.
     */
    static IterationBudget iterationBudget(Duration samplePeriod, Duration overallTimeout) {
        long periods;
        try {
            periods = Math.min(overallTimeout.dividedBy(effectiveSamplePeriod(samplePeriod)), Long.MAX_VALUE - ITERATION_MARGIN);
        } catch (ArithmeticException e) {
            periods = Long.MAX_VALUE - ITERATION_MARGIN;
        }
        return IterationBudget.of(periods + ITERATION_MARGIN);
    }
}
