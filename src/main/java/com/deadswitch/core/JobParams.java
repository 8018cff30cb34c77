package com.deadswitch.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a producer hands to the worker pool to enqueue a job.
 *
 * <p>{@code name} is the de-duplication key, {@code handler} selects the registered
 * {@link JobHandler}. When {@code unique} is set, enqueueing fails with
 * {@link DuplicateJobException} while another job with the same name is scheduled,
 * enqueued or in progress.</p>
 */
public class JobParams {
    private final String name;
    private final String handler;
    private final Map<String, Object> args;
    private final boolean unique;

    public JobParams(String name, String handler, Map<String, Object> args, boolean unique) {
        this.name = name;
        this.handler = handler;
        this.args = args == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
        this.unique = unique;
    }

    public String getName() {
        return name;
    }

    public String getHandler() {
        return handler;
    }

    public Map<String, Object> getArgs() {
        return args;
    }

    public boolean isUnique() {
        return unique;
    }

    @Override
    public String toString() {
        return "JobParams{name='" + name + "', handler='" + handler + "', unique=" + unique + ", args=" + args + "}";
    }
}
