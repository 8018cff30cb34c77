package com.deadswitch.core;

import java.time.LocalDateTime;

/**
 * Audit record of an escalation: which contact was told about which probe, and whether
 * the message went out.
 */
public class EmergencyProbe {
    private long id;
    private long probeId;
    private long contactId;
    private boolean delivered;
    private boolean acknowledged;
    private LocalDateTime createdAt;

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }

    public long getProbeId() { return probeId; }
    public void setProbeId(long probeId) { this.probeId = probeId; }

    public long getContactId() { return contactId; }
    public void setContactId(long contactId) { this.contactId = contactId; }

    public boolean isDelivered() { return delivered; }
    public void setDelivered(boolean delivered) { this.delivered = delivered; }

    public boolean isAcknowledged() { return acknowledged; }
    public void setAcknowledged(boolean acknowledged) { this.acknowledged = acknowledged; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    @Override
    public String toString() {
        return "EmergencyProbe{probeId=" + probeId + ", contactId=" + contactId + ", delivered=" + delivered + "}";
    }
}
