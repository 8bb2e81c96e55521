package io.burt.analytics.configuration;

import software.amazon.awssdk.services.athena.AthenaAsyncClient;

import java.time.Duration;
import java.util.Optional;

public interface ConnectionConfiguration extends AutoCloseable {
    Duration samplePeriod();

    /**
     * @return the maximum time to wait for an operation, or empty when there
     *         is no limit
     */
    Optional<Duration> overallTimeout();

    Duration apiCallTimeout();

    AthenaAsyncClient athenaClient();

    ConnectionConfiguration withSamplePeriod(Duration samplePeriod);

    ConnectionConfiguration withOverallTimeout(Duration overallTimeout);

    ConnectionConfiguration withoutOverallTimeout();

    ConnectionConfiguration withApiCallTimeout(Duration apiCallTimeout);

    @Override
    void close();
}
