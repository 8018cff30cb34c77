package com.deadswitch.core;

import java.time.LocalDateTime;

/**
 * One liveliness check sent to a user. {@code retryCount} counts the follow-ups sent
 * after the initial message.
 */
public class Probe {
    private long id;
    private long userId;
    private String lastResponse;
    private int retryCount;
    private ProbeStatus status;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }

    public long getUserId() { return userId; }
    public void setUserId(long userId) { this.userId = userId; }

    public String getLastResponse() { return lastResponse; }
    public void setLastResponse(String lastResponse) { this.lastResponse = lastResponse; }

    public int getRetryCount() { return retryCount; }
    public void setRetryCount(int retryCount) { this.retryCount = retryCount; }

    public ProbeStatus getStatus() { return status; }
    public void setStatus(ProbeStatus status) { this.status = status; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    public boolean isPending() {
        return status == ProbeStatus.PENDING;
    }

    @Override
    public String toString() {
        return "Probe{id=" + id + ", userId=" + userId + ", status=" + status + ", retryCount=" + retryCount + "}";
    }
}
