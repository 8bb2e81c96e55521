package io.burt.analytics.polling;

@FunctionalInterface
public interface Probe<R> {
    R poll() throws Exception;
}
