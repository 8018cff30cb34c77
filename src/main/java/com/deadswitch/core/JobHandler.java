package com.deadswitch.core;

import java.util.Map;

/**
 * Business logic bound to a handler name in the worker pool.
 *
 * <p>Handlers receive the job's deserialized arguments as a read-only map. They may be
 * called concurrently from several worker threads, and the same job may run more than
 * once (after a failure, or after being reaped as stuck), so implementations should be
 * idempotent where they can.</p>
 *
 * <p>Any exception counts as a failed attempt: the job is retried until it reaches the
 * pool's maximum number of fails and is then marked dead.</p>
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * Run the job.
     *
     * @param args the job arguments; integral numbers are {@link Long}s
     * @throws Exception if the attempt failed
     */
    void handle(Map<String, Object> args) throws Exception;
}
