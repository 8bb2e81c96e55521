package io.burt.analytics.polling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingFaultReporter implements FaultReporter {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingFaultReporter.class);

    @Override
    public void report(String source, Throwable fault) {
        LOG.error("{}: caught exception while polling, polling aborted", source, fault);
    }
}
