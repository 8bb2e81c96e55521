package io.burt.analytics.command;

import io.burt.analytics.operations.JobHandle;
import io.burt.analytics.operations.JobState;
import io.burt.analytics.operations.JobStatus;
import io.burt.analytics.operations.StatusQuery;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks the status of an asynchronous command with
 * <code>.show operations</code>.
 */
public class CommandStatusQuery implements StatusQuery {
    static final String STATE_COLUMN = "State";
    static final String STATUS_COLUMN = "Status";
    static final String OPERATION_ID_COLUMN = "OperationId";

    private static final Map<String, JobState> STATES = new HashMap<>();

    static {
        STATES.put("InProgress", JobState.IN_PROGRESS);
        STATES.put("Completed", JobState.COMPLETED);
        // not started yet, and unlike a queued Athena query this ends polling as the connector always has
        STATES.put("Scheduled", JobState.PENDING);
        STATES.put("Throttled", JobState.PENDING);
        STATES.put("Failed", JobState.FAILED);
        STATES.put("PartiallySucceeded", JobState.FAILED);
        STATES.put("Abandoned", JobState.FAILED);
        STATES.put("BadInput", JobState.FAILED);
        STATES.put("Canceled", JobState.FAILED);
    }

    private final CommandClient client;
    private final String database;

    public CommandStatusQuery(CommandClient client, String database) {
        this.client = client;
        this.database = database;
    }

    public static String showOperationsCommand(String operationId) {
        return String.format(".show operations %s", operationId);
    }

    static JobState parseState(String state) {
        if (state == null) {
            return JobState.UNKNOWN;
        } else {
            return STATES.getOrDefault(state.trim(), JobState.UNKNOWN);
        }
    }

    @Override
    public JobStatus fetch(JobHandle jobHandle) throws IOException {
        CommandResult result = client.execute(database, showOperationsCommand(jobHandle.operationId()));
        if (result.isEmpty()) {
            throw new IllegalStateException(String.format("No operation with OperationId '%s' found in database %s", jobHandle, database));
        }
        List<String> row = result.rows().get(0);
        String state = row.get(requiredColumn(result, STATE_COLUMN));
        String status = row.get(requiredColumn(result, STATUS_COLUMN));
        String operationId = result.columnIndex(OPERATION_ID_COLUMN).isPresent() ? row.get(result.columnIndex(OPERATION_ID_COLUMN).getAsInt()) : jobHandle.operationId();
        return new JobStatus(parseState(state), status, operationId);
    }

    private int requiredColumn(CommandResult result, String columnName) {
        return result.columnIndex(columnName).orElseThrow(() -> new IllegalStateException(String.format("Operation status is missing the %s column", columnName)));
    }
}
