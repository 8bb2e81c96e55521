package io.burt.analytics.configuration;

import software.amazon.awssdk.regions.Region;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Properties;
import java.util.regex.Pattern;

public class ConnectionConfigurationFactory {
    public static final String REGION_PROPERTY_NAME = "region";
    public static final String SAMPLE_PERIOD_PROPERTY_NAME = "samplePeriod";
    public static final String OVERALL_TIMEOUT_PROPERTY_NAME = "overallTimeout";
    public static final String API_CALL_TIMEOUT_PROPERTY_NAME = "apiCallTimeout";
    public static final String NO_TIMEOUT = "none";

    public static final Duration DEFAULT_SAMPLE_PERIOD = Duration.ofSeconds(1);
    public static final Duration DEFAULT_OVERALL_TIMEOUT = Duration.ofHours(1);
    public static final Duration DEFAULT_API_CALL_TIMEOUT = Duration.ofMinutes(1);

    private static final Pattern MILLIS_PATTERN = Pattern.compile("^-?\\d+$");

    public ConnectionConfiguration createConnectionConfiguration(Region awsRegion, Duration samplePeriod, Duration overallTimeout, Duration apiCallTimeout) {
        return new ConcreteConnectionConfiguration(awsRegion, samplePeriod, overallTimeout, apiCallTimeout);
    }

    /**
     * Creates a configuration from properties.
     *
     * Durations can be given either as ISO-8601 durations, like
     * <code>PT30S</code>, or as a number of milliseconds. An overall timeout
     * of <code>none</code>, or a negative one, means that there is no limit.
     * Properties that are not set get their default values.
     *
     * @param properties the properties to read
     * @return a new configuration
     * @throws IllegalArgumentException when a property has a value that
     *                                  cannot be parsed
     */
    public ConnectionConfiguration createConnectionConfiguration(Properties properties) {
        Region region = properties.containsKey(REGION_PROPERTY_NAME) ? Region.of(properties.getProperty(REGION_PROPERTY_NAME)) : null;
        Duration samplePeriod = durationProperty(properties, SAMPLE_PERIOD_PROPERTY_NAME, DEFAULT_SAMPLE_PERIOD);
        Duration apiCallTimeout = durationProperty(properties, API_CALL_TIMEOUT_PROPERTY_NAME, DEFAULT_API_CALL_TIMEOUT);
        Duration overallTimeout;
        if (NO_TIMEOUT.equalsIgnoreCase(properties.getProperty(OVERALL_TIMEOUT_PROPERTY_NAME, "").trim())) {
            overallTimeout = null;
        } else {
            overallTimeout = durationProperty(properties, OVERALL_TIMEOUT_PROPERTY_NAME, DEFAULT_OVERALL_TIMEOUT);
            if (overallTimeout.isNegative()) {
                overallTimeout = null;
            }
        }
        if (samplePeriod.isNegative()) {
            throw new IllegalArgumentException(String.format("Property %s must not be negative, got %s", SAMPLE_PERIOD_PROPERTY_NAME, samplePeriod));
        }
        return createConnectionConfiguration(region, samplePeriod, overallTimeout, apiCallTimeout);
    }

    private Duration durationProperty(Properties properties, String name, Duration defaultValue) {
        String value = properties.getProperty(name);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        value = value.trim();
        try {
            if (MILLIS_PATTERN.matcher(value).matches()) {
                return Duration.ofMillis(Long.parseLong(value));
            } else {
                return Duration.parse(value);
            }
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Property %s is not a valid duration: \"%s\"", name, value), e);
        }
    }
}
