package com.deadswitch.db;

import com.deadswitch.core.JobStatus;

/**
 * Partial update of a job row. Only the fields that were set are written.
 *
 * <pre>{@code
 * store.update(jobId, new JobUpdate().claimed(false).status(JobStatus.ENQUEUED).fails(2).lastError("boom"));
 * }</pre>
 */
public class JobUpdate {
    private Boolean claimed;
    private JobStatus status;
    private Integer fails;
    private String lastError;

    public JobUpdate claimed(boolean claimed) {
        this.claimed = claimed;
        return this;
    }

    public JobUpdate status(JobStatus status) {
        this.status = status;
        return this;
    }

    public JobUpdate fails(int fails) {
        this.fails = fails;
        return this;
    }

    public JobUpdate lastError(String lastError) {
        this.lastError = lastError;
        return this;
    }

    public Boolean getClaimed() { return claimed; }
    public JobStatus getStatus() { return status; }
    public Integer getFails() { return fails; }
    public String getLastError() { return lastError; }

    public boolean isEmpty() {
        return claimed == null && status == null && fails == null && lastError == null;
    }

    @Override
    public String toString() {
        return "JobUpdate{claimed=" + claimed + ", status=" + status + ", fails=" + fails + ", lastError='" + lastError + "'}";
    }
}
