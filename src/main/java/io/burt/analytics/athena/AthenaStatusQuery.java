package io.burt.analytics.athena;

import io.burt.analytics.operations.JobHandle;
import io.burt.analytics.operations.JobState;
import io.burt.analytics.operations.JobStatus;
import io.burt.analytics.operations.StatusQuery;
import software.amazon.awssdk.services.athena.AthenaAsyncClient;
import software.amazon.awssdk.services.athena.model.QueryExecution;
import software.amazon.awssdk.services.athena.model.QueryExecutionState;
import software.amazon.awssdk.services.athena.model.QueryExecutionStatus;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Checks the status of an Athena query execution.
 */
public class AthenaStatusQuery implements StatusQuery {
    private final AthenaAsyncClient athenaClient;
    private final Duration apiCallTimeout;

    public AthenaStatusQuery(AthenaAsyncClient athenaClient, Duration apiCallTimeout) {
        this.athenaClient = athenaClient;
        this.apiCallTimeout = apiCallTimeout;
    }

    @Override
    public JobStatus fetch(JobHandle jobHandle) throws InterruptedException, ExecutionException, TimeoutException {
        QueryExecution queryExecution = athenaClient
                .getQueryExecution(b -> b.queryExecutionId(jobHandle.operationId()))
                .get(apiCallTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .queryExecution();
        QueryExecutionStatus status = queryExecution.status();
        String operationId = queryExecution.queryExecutionId() == null ? jobHandle.operationId() : queryExecution.queryExecutionId();
        return new JobStatus(toJobState(status.state()), status.stateChangeReason(), operationId);
    }

    static JobState toJobState(QueryExecutionState state) {
        if (state == null) {
            return JobState.UNKNOWN;
        }
        switch (state) {
            case QUEUED:
            case RUNNING:
                return JobState.IN_PROGRESS;
            case SUCCEEDED:
                return JobState.COMPLETED;
            case FAILED:
            case CANCELLED:
                return JobState.FAILED;
            default:
                return JobState.UNKNOWN;
        }
    }
}
