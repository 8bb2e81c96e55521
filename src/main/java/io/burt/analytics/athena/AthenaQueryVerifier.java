package io.burt.analytics.athena;

import io.burt.analytics.configuration.ConnectionConfiguration;
import io.burt.analytics.operations.JobHandle;
import io.burt.analytics.operations.OperationCompletionVerifier;
import io.burt.analytics.operations.OperationException;

import java.time.Duration;
import java.util.Optional;

public class AthenaQueryVerifier {
    private final OperationCompletionVerifier verifier;
    private final ConnectionConfiguration configuration;

    public AthenaQueryVerifier(ConnectionConfiguration configuration) {
        this(new OperationCompletionVerifier(), configuration);
    }

    public AthenaQueryVerifier(OperationCompletionVerifier verifier, ConnectionConfiguration configuration) {
        this.verifier = verifier;
        this.configuration = configuration;
    }

    /**
     * Blocks until a query execution has succeeded.
     *
     * Queued and running executions are polled with the sample period of the
     * configuration, for at most its overall timeout. Failed and cancelled
     * executions raise an {@link io.burt.analytics.operations.OperationFailedException}
     * with the state change reason as status detail.
     *
     * @param queryExecutionId the ID returned by <code>StartQueryExecution</code>
     * @throws OperationException when the execution did not succeed
     * @throws InterruptedException when the calling thread is interrupted
     */
    public void verifyQueryCompletion(String queryExecutionId) throws OperationException, InterruptedException {
        AthenaStatusQuery statusQuery = new AthenaStatusQuery(configuration.athenaClient(), configuration.apiCallTimeout());
        JobHandle jobHandle = JobHandle.of(queryExecutionId);
        Duration samplePeriod = configuration.samplePeriod();
        Optional<Duration> overallTimeout = configuration.overallTimeout();
        if (overallTimeout.isPresent()) {
            verifier.verify(statusQuery, jobHandle, samplePeriod, overallTimeout.get());
        } else {
            verifier.verifyWithoutTimeout(statusQuery, jobHandle, samplePeriod);
        }
    }
}
