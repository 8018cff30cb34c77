package com.deadswitch.core;

import java.time.LocalDateTime;

/**
 * Someone a user trusts. Contacts flagged as emergency contacts are notified when
 * the user stops answering probes.
 */
public class Contact {
    private long id;
    private long userId;
    private String firstName;
    private String lastName;
    private String phoneNumber;
    private String email;
    private boolean emergencyContact;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }

    public long getUserId() { return userId; }
    public void setUserId(long userId) { this.userId = userId; }

    public String getFirstName() { return firstName; }
    public void setFirstName(String firstName) { this.firstName = firstName; }

    public String getLastName() { return lastName; }
    public void setLastName(String lastName) { this.lastName = lastName; }

    public String getPhoneNumber() { return phoneNumber; }
    public void setPhoneNumber(String phoneNumber) { this.phoneNumber = phoneNumber; }

    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }

    public boolean isEmergencyContact() { return emergencyContact; }
    public void setEmergencyContact(boolean emergencyContact) { this.emergencyContact = emergencyContact; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public String toString() {
        return "Contact{id=" + id + ", userId=" + userId + ", emergency=" + emergencyContact + "}";
    }
}
