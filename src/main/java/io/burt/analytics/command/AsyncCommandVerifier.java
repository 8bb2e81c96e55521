package io.burt.analytics.command;

import io.burt.analytics.configuration.ConnectionConfiguration;
import io.burt.analytics.operations.JobHandle;
import io.burt.analytics.operations.OperationCompletionVerifier;
import io.burt.analytics.operations.OperationException;

import java.time.Duration;
import java.util.Optional;

/**
 * Waits for commands that were executed with the <code>async</code>
 * modifier to finish.
 */
public class AsyncCommandVerifier {
    private final OperationCompletionVerifier verifier;
    private final ConnectionConfiguration configuration;

    public AsyncCommandVerifier(ConnectionConfiguration configuration) {
        this(new OperationCompletionVerifier(), configuration);
    }

    public AsyncCommandVerifier(OperationCompletionVerifier verifier, ConnectionConfiguration configuration) {
        this.verifier = verifier;
        this.configuration = configuration;
    }

    /**
     * Extracts the operation ID from the result of an async command, which is
     * the first value of the first row.
     *
     * @param asyncCommandResult the result returned when the async command
     *                           was executed
     * @return a handle for the operation
     * @throws IllegalArgumentException when the result has no values
     */
    public static JobHandle operationHandle(CommandResult asyncCommandResult) {
        if (asyncCommandResult.isEmpty() || asyncCommandResult.columnNames().isEmpty()) {
            throw new IllegalArgumentException("The result of an async command must contain an operation ID");
        }
        return JobHandle.of(asyncCommandResult.rows().get(0).get(0));
    }

    /**
     * Waits with the sample period and timeout of the configuration.
     *
     * @see #verifyAsyncCommandCompletion(CommandClient, String, CommandResult, Duration, Optional)
     */
    public void verifyAsyncCommandCompletion(CommandClient client, String database, CommandResult asyncCommandResult) throws OperationException, InterruptedException {
        verifyAsyncCommandCompletion(client, database, asyncCommandResult, configuration.samplePeriod(), configuration.overallTimeout());
    }

    /**
     * Blocks until the operation started by an async command has completed.
     *
     * @param client the client used to check the status of the operation
     * @param database the database the command was executed in
     * @param asyncCommandResult the result returned when the async command
     *                           was executed
     * @param samplePeriod the delay before the second status check
     * @param timeout the maximum time to wait, or empty to wait indefinitely
     * @throws OperationException when the operation did not complete within
     *                            the timeout, or ended in another state
     * @throws InterruptedException when the calling thread is interrupted
     */
    public void verifyAsyncCommandCompletion(CommandClient client, String database, CommandResult asyncCommandResult, Duration samplePeriod, Optional<Duration> timeout) throws OperationException, InterruptedException {
        JobHandle jobHandle = operationHandle(asyncCommandResult);
        CommandStatusQuery statusQuery = new CommandStatusQuery(client, database);
        if (timeout.isPresent()) {
            verifier.verify(statusQuery, jobHandle, samplePeriod, timeout.get());
        } else {
            verifier.verifyWithoutTimeout(statusQuery, jobHandle, samplePeriod);
        }
    }
}
