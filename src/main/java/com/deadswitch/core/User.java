package com.deadswitch.core;

import java.time.LocalDateTime;

/**
 * A registered user. Every user has exactly one {@link ProbeSetting}.
 */
public class User {
    private long id;
    private String firstName;
    private String lastName;
    private String phoneNumber;
    private String email;
    private ProbeSetting probeSetting;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }

    public String getFirstName() { return firstName; }
    public void setFirstName(String firstName) { this.firstName = firstName; }

    public String getLastName() { return lastName; }
    public void setLastName(String lastName) { this.lastName = lastName; }

    public String getPhoneNumber() { return phoneNumber; }
    public void setPhoneNumber(String phoneNumber) { this.phoneNumber = phoneNumber; }

    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }

    public ProbeSetting getProbeSetting() { return probeSetting; }
    public void setProbeSetting(ProbeSetting probeSetting) { this.probeSetting = probeSetting; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public String toString() {
        return "User{id=" + id + ", firstName='" + firstName + "', phone='" + phoneNumber + "'}";
    }
}
