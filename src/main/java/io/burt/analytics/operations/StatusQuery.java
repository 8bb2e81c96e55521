package io.burt.analytics.operations;

/**
 * Fetches the current status of a remote operation.
 *
 * Implementations make one request per call and may block while doing so.
 * Any exception thrown ends the verification of the operation, it is not
 * retried.
 */
@FunctionalInterface
public interface StatusQuery {
    JobStatus fetch(JobHandle jobHandle) throws Exception;
}
