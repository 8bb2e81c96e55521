package io.burt.analytics.polling;

import io.burt.analytics.support.TestNameGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(TestNameGenerator.class)
class BackoffSchedulerTest {
    @Mock private FaultReporter faultReporter;

    private InlineSchedulerFactory inlineSchedulerFactory;
    private BackoffScheduler scheduler;
    private List<Integer> stopped;

    @BeforeEach
    void setUp() {
        inlineSchedulerFactory = new InlineSchedulerFactory();
        scheduler = inlineSchedulerFactory.scheduler(faultReporter);
        stopped = new CopyOnWriteArrayList<>();
    }

    private Probe<Integer> countingProbe(AtomicInteger counter) {
        return counter::incrementAndGet;
    }

    @Nested
    class Schedule {
        @Test
        void pollsUntilTheStopConditionIsNoLongerSatisfied() throws Exception {
            AtomicInteger counter = new AtomicInteger(0);
            WaitHandle<Integer> handle = scheduler.schedule(countingProbe(counter), Duration.ZERO, Duration.ofMillis(3), IterationBudget.unbounded(), n -> n < 4, stopped::add);
            assertEquals(4, counter.get());
            assertEquals(4, handle.invocations());
            assertEquals(4, handle.await());
        }

        @Test
        void passesTheLastResultToOnStopExactlyOnce() {
            AtomicInteger counter = new AtomicInteger(0);
            scheduler.schedule(countingProbe(counter), Duration.ZERO, Duration.ofMillis(3), IterationBudget.unbounded(), n -> n < 4, stopped::add);
            assertEquals(List.of(4), stopped);
        }

        @Test
        void waitsTheInitialDelayBeforeTheFirstInvocation() {
            AtomicInteger counter = new AtomicInteger(0);
            scheduler.schedule(countingProbe(counter), Duration.ofMillis(250), Duration.ofMillis(3), IterationBudget.unbounded(), n -> false, stopped::add);
            assertEquals(List.of(Duration.ofMillis(250)), inlineSchedulerFactory.delays());
        }

        @Test
        void doublesTheDelayAfterEachInvocationUpToOneMinute() {
            AtomicInteger counter = new AtomicInteger(0);
            scheduler.schedule(countingProbe(counter), Duration.ZERO, Duration.ofSeconds(10), IterationBudget.unbounded(), n -> n < 8, stopped::add);
            List<Duration> delays = inlineSchedulerFactory.delays();
            assertEquals(8, delays.size());
            assertEquals(Duration.ZERO, delays.get(0));
            assertEquals(Duration.ofSeconds(10), delays.get(1));
            assertEquals(Duration.ofSeconds(20), delays.get(2));
            assertEquals(Duration.ofSeconds(40), delays.get(3));
            assertEquals(Duration.ofMinutes(1), delays.get(4));
            assertEquals(Duration.ofMinutes(1), delays.get(5));
            assertEquals(Duration.ofMinutes(1), delays.get(6));
            assertEquals(Duration.ofMinutes(1), delays.get(7));
        }

        @Test
        void limitsAStepDelayAboveOneMinuteToOneMinute() {
            AtomicInteger counter = new AtomicInteger(0);
            scheduler.schedule(countingProbe(counter), Duration.ZERO, Duration.ofMinutes(5), IterationBudget.unbounded(), n -> n < 3, stopped::add);
            List<Duration> delays = inlineSchedulerFactory.delays();
            assertEquals(Duration.ofMinutes(1), delays.get(1));
            assertEquals(Duration.ofMinutes(1), delays.get(2));
        }

        @Test
        void shutsDownTheExecutorWhenDone() {
            scheduler.schedule(() -> 1, Duration.ZERO, Duration.ofMillis(3), IterationBudget.unbounded(), n -> false, stopped::add);
            assertEquals(1, inlineSchedulerFactory.shutdowns());
        }

        @Test
        void rejectsNegativeDelays() {
            assertThrows(IllegalArgumentException.class, () -> scheduler.schedule(() -> 1, Duration.ofMillis(-1), Duration.ZERO, IterationBudget.unbounded(), n -> false, stopped::add));
            assertThrows(IllegalArgumentException.class, () -> scheduler.schedule(() -> 1, Duration.ZERO, Duration.ofMillis(-1), IterationBudget.unbounded(), n -> false, stopped::add));
            assertTrue(inlineSchedulerFactory.delays().isEmpty());
        }

        @Nested
        class WithABoundedBudget {
            @Test
            void failsWithATimeoutWhenTheBudgetIsExhausted() {
                AtomicInteger counter = new AtomicInteger(0);
                WaitHandle<Integer> handle = scheduler.schedule(countingProbe(counter), Duration.ZERO, Duration.ofMillis(3), IterationBudget.of(6), n -> true, stopped::add);
                ExecutionException ee = assertThrows(ExecutionException.class, handle::await);
                IterationBudgetExhaustedException e = assertInstanceOf(IterationBudgetExhaustedException.class, ee.getCause());
                assertEquals(6, e.maxIterations());
                assertEquals(6, counter.get());
            }

            @Test
            void doesNotCallOnStopWhenTheBudgetIsExhausted() {
                AtomicInteger counter = new AtomicInteger(0);
                scheduler.schedule(countingProbe(counter), Duration.ZERO, Duration.ofMillis(3), IterationBudget.of(6), n -> true, stopped::add);
                assertTrue(stopped.isEmpty());
                assertEquals(1, inlineSchedulerFactory.shutdowns());
            }

            @Test
            void failsOnTheLastInvocationEvenIfTheStopConditionIsNoLongerSatisfied() {
                AtomicInteger counter = new AtomicInteger(0);
                WaitHandle<Integer> handle = scheduler.schedule(countingProbe(counter), Duration.ZERO, Duration.ofMillis(3), IterationBudget.of(3), n -> n < 3, stopped::add);
                assertInstanceOf(IterationBudgetExhaustedException.class, handle.failure().get());
                assertTrue(stopped.isEmpty());
            }

            @Test
            void stopsNormallyWithinTheBudget() throws Exception {
                AtomicInteger counter = new AtomicInteger(0);
                WaitHandle<Integer> handle = scheduler.schedule(countingProbe(counter), Duration.ZERO, Duration.ofMillis(3), IterationBudget.of(3), n -> n < 2, stopped::add);
                assertEquals(2, handle.await());
                assertEquals(List.of(2), stopped);
            }
        }

        @Nested
        class WhenTheProbeThrowsAnException {
            @Test
            void failsTheHandleWithTheException() {
                IOException e = new IOException("b0rk");
                WaitHandle<Integer> handle = scheduler.schedule(() -> {
                    throw e;
                }, Duration.ZERO, Duration.ofMillis(3), IterationBudget.unbounded(), n -> true, stopped::add);
                ExecutionException ee = assertThrows(ExecutionException.class, handle::await);
                assertSame(e, ee.getCause());
            }

            @Test
            void stopsPollingWithoutCallingOnStop() {
                AtomicInteger counter = new AtomicInteger(0);
                WaitHandle<Integer> handle = scheduler.schedule(() -> {
                    if (counter.incrementAndGet() == 2) {
                        throw new IOException("b0rk");
                    }
                    return counter.get();
                }, Duration.ZERO, Duration.ofMillis(3), IterationBudget.unbounded(), n -> true, stopped::add);
                assertEquals(2, counter.get());
                assertEquals(2, handle.invocations());
                assertTrue(stopped.isEmpty());
                assertEquals(1, inlineSchedulerFactory.shutdowns());
            }

            @Test
            void reportsTheException() {
                IOException e = new IOException("b0rk");
                WaitHandle<Integer> handle = scheduler.schedule(() -> {
                    throw e;
                }, Duration.ZERO, Duration.ofMillis(3), IterationBudget.unbounded(), n -> true, stopped::add);
                assertTrue(handle.isResolved());
                verify(faultReporter).report(anyString(), eq(e));
            }

            @Test
            void doesNotReportAnExhaustedBudget() {
                scheduler.schedule(() -> 1, Duration.ZERO, Duration.ofMillis(3), IterationBudget.of(2), n -> true, stopped::add);
                verify(faultReporter, never()).report(anyString(), any());
            }
        }
    }

    @Nested
    class WithABackgroundThread {
        private ThreadedSchedulerFactory threadedSchedulerFactory;

        @BeforeEach
        void setUp() {
            threadedSchedulerFactory = new ThreadedSchedulerFactory("test-poller");
            scheduler = threadedSchedulerFactory.scheduler(faultReporter);
        }

        @AfterEach
        void tearDown() {
            threadedSchedulerFactory.shutdownNow();
        }

        @Test
        void invokesTheProbeOnADaemonThreadByDefault() throws Exception {
            AtomicReference<Thread> probeThread = new AtomicReference<>();
            WaitHandle<Integer> handle = new BackoffScheduler("default-poller", faultReporter).schedule(() -> {
                probeThread.set(Thread.currentThread());
                return 1;
            }, Duration.ZERO, Duration.ofMillis(1), IterationBudget.unbounded(), n -> false, stopped::add);
            assertTrue(handle.await(Duration.ofSeconds(5)));
            assertTrue(probeThread.get().isDaemon());
            assertTrue(probeThread.get().getName().startsWith("default-poller-"));
        }

        @Test
        void invokesTheProbeOnAnotherThread() throws Exception {
            AtomicReference<Thread> probeThread = new AtomicReference<>();
            WaitHandle<Integer> handle = scheduler.schedule(() -> {
                probeThread.set(Thread.currentThread());
                return 1;
            }, Duration.ZERO, Duration.ofMillis(1), IterationBudget.unbounded(), n -> false, stopped::add);
            assertTrue(handle.await(Duration.ofSeconds(5)));
            assertNotSame(Thread.currentThread(), probeThread.get());
            assertTrue(probeThread.get().isDaemon());
            assertTrue(probeThread.get().getName().startsWith("test-poller-"));
        }

        @Test
        void returnsBeforeTheFirstInvocation() {
            AtomicInteger counter = new AtomicInteger(0);
            WaitHandle<Integer> handle = scheduler.schedule(countingProbe(counter), Duration.ofSeconds(30), Duration.ofMillis(1), IterationBudget.unbounded(), n -> false, stopped::add);
            assertFalse(handle.isResolved());
            assertEquals(0, handle.invocations());
        }

        @Test
        void awaitWithATimeoutReturnsFalseWhilePollingContinues() throws Exception {
            WaitHandle<Integer> handle = scheduler.schedule(() -> 1, Duration.ZERO, Duration.ofMillis(50), IterationBudget.unbounded(), n -> true, stopped::add);
            assertFalse(handle.await(Duration.ofMillis(20)));
            assertFalse(handle.isResolved());
        }

        @Test
        void neverRunsTwoInvocationsAtTheSameTime() throws Exception {
            AtomicInteger running = new AtomicInteger(0);
            AtomicInteger maxRunning = new AtomicInteger(0);
            AtomicInteger counter = new AtomicInteger(0);
            WaitHandle<Integer> handle = scheduler.schedule(() -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                Thread.sleep(2);
                running.decrementAndGet();
                return counter.incrementAndGet();
            }, Duration.ZERO, Duration.ofMillis(1), IterationBudget.unbounded(), n -> n < 6, stopped::add);
            assertEquals(6, handle.await());
            assertEquals(1, maxRunning.get());
            assertEquals(List.of(6), stopped);
        }

        @Test
        void releasesTheWaiterWhenTheProbeThrows() {
            WaitHandle<Integer> handle = scheduler.schedule(() -> {
                throw new IllegalStateException("b0rk");
            }, Duration.ZERO, Duration.ofMillis(1), IterationBudget.unbounded(), n -> true, stopped::add);
            ExecutionException ee = assertThrows(ExecutionException.class, () -> handle.await(Duration.ofSeconds(5)));
            assertInstanceOf(IllegalStateException.class, ee.getCause());
        }

        @Test
        void releasesTheWaiterWhenTheProbeThrowsAnError() {
            AssertionError error = new AssertionError("b0rk");
            WaitHandle<Integer> handle = scheduler.schedule(() -> {
                throw error;
            }, Duration.ZERO, Duration.ofMillis(1), IterationBudget.unbounded(), n -> true, stopped::add);
            ExecutionException ee = assertThrows(ExecutionException.class, () -> handle.await(Duration.ofSeconds(5)));
            assertSame(error, ee.getCause());
            assertEquals(1, handle.invocations());
            assertTrue(stopped.isEmpty());
        }

        @Test
        void reportsAnErrorThrownByTheProbe() {
            AssertionError error = new AssertionError("b0rk");
            WaitHandle<Integer> handle = scheduler.schedule(() -> {
                throw error;
            }, Duration.ZERO, Duration.ofMillis(1), IterationBudget.unbounded(), n -> true, stopped::add);
            verify(faultReporter, timeout(5000)).report(anyString(), eq(error));
            assertTrue(handle.isResolved());
        }

        @Test
        void acceptsAnInitialDelayTooLongForNanoseconds() {
            WaitHandle<Integer> handle = scheduler.schedule(() -> 1, Duration.ofDays(365L * 300), Duration.ofMillis(1), IterationBudget.unbounded(), n -> false, stopped::add);
            assertFalse(handle.isResolved());
            assertEquals(0, handle.invocations());
        }
    }
}
