package com.deadswitch.core;

/**
 * Enum representing the states a job moves through in the queue.
 *
 * <p>State Transitions:</p>
 * <ul>
 *   <li>SCHEDULED → ENQUEUED: the job's run-after time has passed and it was promoted</li>
 *   <li>ENQUEUED → IN_PROGRESS: a worker won the claim</li>
 *   <li>IN_PROGRESS → SUCCESSFUL: the handler returned normally</li>
 *   <li>IN_PROGRESS → ENQUEUED: the handler failed with retries left, or the job was reaped as stuck</li>
 *   <li>IN_PROGRESS → DEAD: the handler exhausted its retries (or no handler exists)</li>
 * </ul>
 *
 * <p>The stored value is {@link #getDbName()}, which references the seeded {@code job_statuses} table.
 * Transitions are enforced by the conditional updates in the job store.</p>
 */
public enum JobStatus {
    SCHEDULED("scheduled"),
    ENQUEUED("enqueued"),
    IN_PROGRESS("in-progress"),
    SUCCESSFUL("successful"),
    DEAD("dead");

    private final String dbName;

    JobStatus(String dbName) {
        this.dbName = dbName;
    }

    /**
     * Get the name stored in the {@code status} column.
     *
     * @return the database name (e.g., "in-progress")
     */
    public String getDbName() {
        return dbName;
    }

    /**
     * Check if this status is terminal. Terminal jobs never run again and no longer
     * count towards name uniqueness.
     *
     * @return true for SUCCESSFUL and DEAD
     */
    public boolean isTerminal() {
        return this == SUCCESSFUL || this == DEAD;
    }

    /**
     * Resolve a status from its stored name.
     *
     * @param dbName the value of the {@code status} column
     * @return the matching status
     * @throws IllegalArgumentException if the name is not a known status
     */
    public static JobStatus fromDbName(String dbName) {
        for (JobStatus status : values()) {
            if (status.dbName.equals(dbName)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + dbName);
    }

    @Override
    public String toString() {
        return dbName;
    }
}
