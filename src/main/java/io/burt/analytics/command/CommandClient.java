package io.burt.analytics.command;

import java.io.IOException;

/**
 * Executes control commands and queries against a database of the remote
 * analytics service.
 */
@FunctionalInterface
public interface CommandClient {
    CommandResult execute(String database, String command) throws IOException;
}
