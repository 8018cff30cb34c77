package com.deadswitch.core;

import java.time.LocalDateTime;

/**
 * A job record as stored in the {@code jobs} table.
 *
 * <p>Jobs are never deleted: once they reach SUCCESSFUL or DEAD they remain as an
 * audit trail of what ran, how often it failed and why.</p>
 */
public class Job {
    private long id;
    private String name;
    private String handler;
    private String args;
    private int fails;
    private String lastError;
    private boolean claimed;
    private JobStatus status;
    private LocalDateTime runAfter;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getHandler() { return handler; }
    public void setHandler(String handler) { this.handler = handler; }

    /** Serialized JSON form of the handler arguments. */
    public String getArgs() { return args; }
    public void setArgs(String args) { this.args = args; }

    public int getFails() { return fails; }
    public void setFails(int fails) { this.fails = fails; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }

    public boolean isClaimed() { return claimed; }
    public void setClaimed(boolean claimed) { this.claimed = claimed; }

    public JobStatus getStatus() { return status; }
    public void setStatus(JobStatus status) { this.status = status; }

    public LocalDateTime getRunAfter() { return runAfter; }
    public void setRunAfter(LocalDateTime runAfter) { this.runAfter = runAfter; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public String toString() {
        return "Job{id=" + id + ", name='" + name + "', handler='" + handler + "', status=" + status
                + ", claimed=" + claimed + ", fails=" + fails + "}";
    }
}
