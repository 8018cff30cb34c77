package com.deadswitch.core;

/**
 * Thrown when a unique job is created while another job with the same name is
 * scheduled, enqueued or in progress.
 *
 * <p>This is an expected outcome rather than a failure: the work is already queued.
 * The worker pool logs it as a warning and carries on as if the enqueue succeeded.</p>
 */
public class DuplicateJobException extends RuntimeException {

    private final String jobName;

    public DuplicateJobException(String jobName) {
        super("Job with the given name already exists in queue: " + jobName);
        this.jobName = jobName;
    }

    public DuplicateJobException(String jobName, Throwable cause) {
        super("Job with the given name already exists in queue: " + jobName, cause);
        this.jobName = jobName;
    }

    /**
     * Get the name that is already taken.
     */
    public String getJobName() {
        return jobName;
    }
}
