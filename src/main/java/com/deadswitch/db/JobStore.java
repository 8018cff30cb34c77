package com.deadswitch.db;

import com.deadswitch.core.DuplicateJobException;
import com.deadswitch.core.Job;
import com.deadswitch.core.JobStatus;

import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence contract for the job queue.
 *
 * <p>Workers, requeuers and producers share one store and coordinate only through it.
 * Every method must be safe to call concurrently, from this process or from another
 * process using the same database. {@link #claim(long)} is the single mechanism that
 * keeps two workers from running the same job.</p>
 *
 * @see JobRepository
 */
public interface JobStore {

    /**
     * Insert an enqueued job unless a job with the same name is scheduled, enqueued or
     * in progress. An existing job is never overwritten.
     *
     * @throws DuplicateJobException if the name is taken
     */
    Job createUniqueJob(String name, String handler, String args) throws SQLException;

    /**
     * Insert a job without any uniqueness check. It starts SCHEDULED when {@code runAfter}
     * is in the future, ENQUEUED otherwise (including when it is null).
     */
    Job createJob(String name, String handler, String args, LocalDateTime runAfter) throws SQLException;

    /**
     * Oldest job (by insertion order) in the given status and claimed state.
     */
    Optional<Job> firstJob(JobStatus status, boolean claimed) throws SQLException;

    /**
     * Oldest scheduled job whose run-after time has passed.
     */
    Optional<Job> firstScheduledJobDue() throws SQLException;

    /**
     * Move a scheduled job to the queue.
     *
     * @return false if the job was no longer scheduled
     */
    boolean promoteScheduledJob(long jobId) throws SQLException;

    /**
     * Atomically take ownership of an enqueued, unclaimed job and mark it in progress.
     *
     * @return true if this caller won the claim
     */
    boolean claim(long jobId) throws SQLException;

    /**
     * Write the fields set on {@code update}.
     */
    void update(long jobId, JobUpdate update) throws SQLException;

    /**
     * Oldest job in {@code status} that has not been updated for at least {@code minutes}.
     */
    Optional<Job> lastUpdatedOlderThan(int minutes, JobStatus status) throws SQLException;

    /**
     * Return an in-progress job to the queue, unclaimed. The fail counter is not touched.
     *
     * @return false if the job was no longer in progress
     */
    boolean requeueStuckJob(long jobId) throws SQLException;

    Optional<Job> findJob(long jobId) throws SQLException;

    /**
     * All jobs with the given name, oldest first.
     */
    List<Job> jobsByName(String name) throws SQLException;

    /**
     * Number of jobs per status; every status is present.
     */
    Map<JobStatus, Integer> countByStatus() throws SQLException;
}
