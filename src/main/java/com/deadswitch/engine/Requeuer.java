package com.deadswitch.engine;

import com.deadswitch.config.ServiceConfig;
import com.deadswitch.core.Job;
import com.deadswitch.core.JobStatus;
import com.deadswitch.db.JobStore;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background loop that puts jobs back on the queue.
 *
 * <ul>
 *   <li>{@link Source#STUCK}: in-progress jobs that have not been touched for the stale
 *       threshold, typically left behind by a crashed process. They are requeued with their
 *       fail count unchanged.</li>
 *   <li>{@link Source#SCHEDULED}: delayed jobs whose run-after time has passed.</li>
 * </ul>
 *
 * <p>After moving a job the loop polls again at the default tick; when there is nothing to
 * move it idles for the source's idle period.</p>
 */
public class Requeuer extends PollingLoop {
    private static final Logger logger = Logger.getLogger(Requeuer.class.getName());

    public enum Source {
        STUCK,
        SCHEDULED
    }

    private final Source source;
    private final JobStore store;
    private final int staleAfterMinutes;
    private final Duration idle;
    private final Duration tick;
    private final Duration errorTick;

    public Requeuer(Source source, JobStore store, ServiceConfig config) {
        super(source == Source.STUCK ? "stuck-job-requeuer" : "scheduled-job-requeuer");
        this.source = source;
        this.store = store;
        this.staleAfterMinutes = config.getStaleAfterMinutes();
        this.idle = source == Source.STUCK ? config.getReaperIdle() : config.getPromoterIdle();
        this.tick = config.getWorkerTick();
        this.errorTick = config.getWorkerErrorTick();
    }

    public Source getSource() {
        return source;
    }

    /**
     * Move at most one job back to the queue.
     *
     * @return true if a candidate was found, even if another process moved it first
     * @throws SQLException if the store fails
     */
    public boolean requeueNext() throws SQLException {
        if (source == Source.STUCK) {
            Optional<Job> stuck = store.lastUpdatedOlderThan(staleAfterMinutes, JobStatus.IN_PROGRESS);
            if (stuck.isEmpty()) {
                return false;
            }

            Job job = stuck.get();
            boolean requeued = store.requeueStuckJob(job.getId());
            if (requeued) {
                logger.warning("[" + getName() + "] job " + job.getId() + " (" + job.getName() + ") was stuck in progress"
                        + " since " + job.getUpdatedAt() + ", requeued");
            }
            return true;
        }

        Optional<Job> due = store.firstScheduledJobDue();
        if (due.isEmpty()) {
            return false;
        }

        Job job = due.get();
        boolean promoted = store.promoteScheduledJob(job.getId());
        if (promoted) {
            logger.info("[" + getName() + "] job " + job.getId() + " (" + job.getName() + ") enqueued");
        }
        return true;
    }

    @Override
    protected Duration pollOnce() {
        try {
            return requeueNext() ? tick : idle;
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "[" + getName() + "] store error", e);
            return errorTick;
        }
    }

    @Override
    protected Duration errorWait() {
        return errorTick;
    }
}
