package io.burt.analytics.polling;

/**
 * Receives the exceptions that end a polling run.
 *
 * A scheduler run executes on a background thread where nobody can catch
 * what the probe throws, so the exception is handed to a reporter in
 * addition to failing the run's {@link WaitHandle}.
 */
@FunctionalInterface
public interface FaultReporter {
    void report(String source, Throwable fault);
}
