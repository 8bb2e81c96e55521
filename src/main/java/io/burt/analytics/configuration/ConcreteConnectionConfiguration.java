package io.burt.analytics.configuration;

import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.athena.AthenaAsyncClient;

import java.time.Duration;
import java.util.Optional;

class ConcreteConnectionConfiguration implements ConnectionConfiguration {
    private final Region awsRegion;
    private final Duration samplePeriod;
    private final Duration overallTimeout;
    private final Duration apiCallTimeout;

    private AthenaAsyncClient athenaClient;

    ConcreteConnectionConfiguration(Region awsRegion, Duration samplePeriod, Duration overallTimeout, Duration apiCallTimeout) {
        this.awsRegion = awsRegion;
        this.samplePeriod = samplePeriod;
        this.overallTimeout = overallTimeout;
        this.apiCallTimeout = apiCallTimeout;
    }

    private ConcreteConnectionConfiguration(Region awsRegion, Duration samplePeriod, Duration overallTimeout, Duration apiCallTimeout, AthenaAsyncClient athenaClient) {
        this(awsRegion, samplePeriod, overallTimeout, apiCallTimeout);
        this.athenaClient = athenaClient;
    }

    Region awsRegion() {
        return awsRegion;
    }

    @Override
    public Duration samplePeriod() {
        return samplePeriod;
    }

    @Override
    public Optional<Duration> overallTimeout() {
        return Optional.ofNullable(overallTimeout);
    }

    @Override
    public Duration apiCallTimeout() {
        return apiCallTimeout;
    }

    @Override
    public AthenaAsyncClient athenaClient() {
        if (athenaClient == null) {
            athenaClient = AthenaAsyncClient.builder().region(awsRegion).build();
        }
        return athenaClient;
    }

    @Override
    public ConnectionConfiguration withSamplePeriod(Duration samplePeriod) {
        return new ConcreteConnectionConfiguration(awsRegion, samplePeriod, overallTimeout, apiCallTimeout, athenaClient);
    }

    @Override
    public ConnectionConfiguration withOverallTimeout(Duration overallTimeout) {
        return new ConcreteConnectionConfiguration(awsRegion, samplePeriod, overallTimeout, apiCallTimeout, athenaClient);
    }

    @Override
    public ConnectionConfiguration withoutOverallTimeout() {
        return new ConcreteConnectionConfiguration(awsRegion, samplePeriod, null, apiCallTimeout, athenaClient);
    }

    @Override
    public ConnectionConfiguration withApiCallTimeout(Duration apiCallTimeout) {
        return new ConcreteConnectionConfiguration(awsRegion, samplePeriod, overallTimeout, apiCallTimeout, athenaClient);
    }

    @Override
    public void close() {
        if (athenaClient != null) {
            athenaClient.close();
            athenaClient = null;
        }
    }
}
