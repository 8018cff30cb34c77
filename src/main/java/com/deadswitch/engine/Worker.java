package com.deadswitch.engine;

import com.deadswitch.config.ServiceConfig;
import com.deadswitch.core.DuplicateHandlerException;
import com.deadswitch.core.Job;
import com.deadswitch.core.JobArgs;
import com.deadswitch.core.JobHandler;
import com.deadswitch.core.JobStatus;
import com.deadswitch.db.JobStore;
import com.deadswitch.db.JobUpdate;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Polling worker that claims one job at a time from the store and runs it.
 *
 * <p><b>Per poll:</b></p>
 * <ol>
 *   <li>Fetch the oldest enqueued, unclaimed job. If there is none, climb the
 *       {@link PollBackoff} ladder and wait.</li>
 *   <li>Claim it. Losing the claim to another worker means re-polling at the default tick.</li>
 *   <li>Deserialize the args and run the handler registered under the job's handler name.</li>
 *   <li>Record the outcome, reset the ladder and re-poll at the default tick.</li>
 * </ol>
 *
 * <p><b>Failure policy:</b></p>
 * <ul>
 *   <li>Handler throws (an {@link Error} included), or args cannot be parsed: {@code fails + 1}; the job goes back to the
 *       queue, or is marked DEAD once {@code fails} reaches the configured maximum</li>
 *   <li>No handler registered under the name: DEAD immediately</li>
 *   <li>Store errors: logged, retried after the error tick</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> each worker runs on its own thread. Exclusivity between workers,
 * including workers in other processes, comes only from {@link JobStore#claim(long)}.</p>
 *
 * @see WorkerPool
 */
public class Worker extends PollingLoop {
    private static final Logger logger = Logger.getLogger(Worker.class.getName());

    static final int MAX_ERROR_LENGTH = 4000;

    private final JobStore store;
    private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();
    private final PollBackoff backoff;
    private final Duration tick;
    private final Duration errorTick;
    private final int maxFails;

    public Worker(String name, JobStore store, ServiceConfig config) {
        super(name);
        this.store = store;
        this.backoff = new PollBackoff(config.getPollBackoff());
        this.tick = config.getWorkerTick();
        this.errorTick = config.getWorkerErrorTick();
        this.maxFails = config.getMaxFails();
    }

    /**
     * Bind a name to a handler.
     *
     * @throws DuplicateHandlerException if the name is already bound
     */
    public void registerHandler(String name, JobHandler handler) {
        if (handlers.putIfAbsent(name, handler) != null) {
            throw new DuplicateHandlerException(name);
        }
    }

    public boolean hasHandler(String name) {
        return handlers.containsKey(name);
    }

    @Override
    protected Duration pollOnce() {
        Optional<Job> next;
        try {
            next = store.firstJob(JobStatus.ENQUEUED, false);
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "[" + getName() + "] failed to fetch next job", e);
            return errorTick;
        }

        if (next.isEmpty()) {
            Duration wait = backoff.next();
            logger.fine("[" + getName() + "] no job in queue, sleeping " + wait.toMillis() + "ms");
            return wait;
        }

        Job job = next.get();
        boolean claimed;
        try {
            claimed = store.claim(job.getId());
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "[" + getName() + "] failed to claim job " + job.getId(), e);
            return errorTick;
        }

        if (!claimed) {
            logger.fine("[" + getName() + "] lost claim on job " + job.getId());
            return tick;
        }

        processJob(job);
        backoff.reset();
        return tick;
    }

    @Override
    protected Duration errorWait() {
        return errorTick;
    }

    void processJob(Job job) {
        logger.info("[" + getName() + "] running job " + job.getId() + " (" + job.getName() + ", handler "
                + job.getHandler() + ")");

        JobHandler handler = handlers.get(job.getHandler());
        if (handler == null) {
            logger.severe("[" + getName() + "] no handler registered for '" + job.getHandler() + "', job "
                    + job.getId() + " is dead");
            recordOutcome(job, new JobUpdate()
                    .claimed(false)
                    .status(JobStatus.DEAD)
                    .fails(job.getFails() + 1)
                    .lastError("No handler registered under name: " + job.getHandler()));
            return;
        }

        try {
            Map<String, Object> args = JobArgs.fromJson(job.getArgs());
            handler.handle(Collections.unmodifiableMap(args));
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            logger.log(Level.WARNING, "[" + getName() + "] job " + job.getId() + " failed", e);
            recordFailure(job, e);
            return;
        }

        recordOutcome(job, new JobUpdate().claimed(false).status(JobStatus.SUCCESSFUL));
    }

    private void recordFailure(Job job, Throwable cause) {
        int fails = job.getFails() + 1;
        JobStatus status = fails >= maxFails ? JobStatus.DEAD : JobStatus.ENQUEUED;

        recordOutcome(job, new JobUpdate()
                .claimed(false)
                .status(status)
                .fails(fails)
                .lastError(describe(cause)));
    }

    private void recordOutcome(Job job, JobUpdate update) {
        try {
            store.update(job.getId(), update);
            logger.info("[" + getName() + "] job " + job.getId() + " completed with status=" + update.getStatus());
        } catch (SQLException e) {
            // left in progress; the stuck-job reaper will return it to the queue
            logger.log(Level.SEVERE, "[" + getName() + "] failed to record outcome of job " + job.getId(), e);
        }
    }

    static String describe(Throwable e) {
        String text = e.getClass().getSimpleName() + ": " + e.getMessage();
        return text.length() > MAX_ERROR_LENGTH ? text.substring(0, MAX_ERROR_LENGTH) : text;
    }
}
