package com.deadswitch.engine;

import com.deadswitch.config.ServiceConfig;
import com.deadswitch.core.DuplicateHandlerException;
import com.deadswitch.core.DuplicateJobException;
import com.deadswitch.core.Job;
import com.deadswitch.core.JobArgs;
import com.deadswitch.core.JobHandler;
import com.deadswitch.core.JobParams;
import com.deadswitch.db.JobStore;

import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Fixed set of {@link Worker}s plus the two {@link Requeuer}s, sharing one handler registry.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * WorkerPool pool = new WorkerPool(jobRepository, config);
 * pool.registerHandler("send_report", args -> reports.send(JobArgs.getLong(args, "user_id")));
 * pool.start();
 *
 * pool.enqueue(new JobParams("send_report_42", "send_report", Map.of("user_id", 42), true));
 *
 * pool.stop(); // returns once every loop has exited
 * }</pre>
 *
 * <p><b>Lifecycle:</b> {@link #start()} and {@link #stop()} are idempotent, and a stopped pool
 * can be started again. Handlers should be registered before starting; a job whose handler
 * is unknown when it is picked up is marked dead.</p>
 */
public class WorkerPool {
    private static final Logger logger = Logger.getLogger(WorkerPool.class.getName());

    private final JobStore store;
    private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();
    private final List<Worker> workers = new ArrayList<>();
    private final Requeuer stuckJobRequeuer;
    private final Requeuer scheduledJobRequeuer;
    private final AtomicBoolean started = new AtomicBoolean(false);

    public WorkerPool(JobStore store, ServiceConfig config) {
        this.store = store;

        for (int i = 1; i <= config.getWorkerConcurrency(); i++) {
            workers.add(new Worker("worker-" + i, store, config));
        }

        this.stuckJobRequeuer = new Requeuer(Requeuer.Source.STUCK, store, config);
        this.scheduledJobRequeuer = new Requeuer(Requeuer.Source.SCHEDULED, store, config);

        logger.info("Worker pool initialized with " + workers.size() + " workers");
    }

    /**
     * Bind a name to a handler for every worker in the pool.
     *
     * @throws DuplicateHandlerException if the name is already registered with this pool
     */
    public void registerHandler(String name, JobHandler handler) {
        if (handlers.putIfAbsent(name, handler) != null) {
            throw new DuplicateHandlerException(name);
        }

        for (Worker worker : workers) {
            if (!worker.hasHandler(name)) {
                worker.registerHandler(name, handler);
            }
        }
        logger.fine("Registered handler " + name);
    }

    /**
     * Put a job on the queue to run as soon as a worker is free.
     *
     * <p>For unique params, a job with the same name that is already scheduled, enqueued or
     * in progress wins: nothing is created and the result is empty.</p>
     *
     * @return the created job, or empty if it was a duplicate
     * @throws IllegalArgumentException if the name or handler is blank
     * @throws SQLException if the store fails
     */
    public Optional<Job> enqueue(JobParams params) throws SQLException {
        validate(params);
        String args = JobArgs.toJson(params.getArgs());

        try {
            Job job = params.isUnique()
                    ? store.createUniqueJob(params.getName(), params.getHandler(), args)
                    : store.createJob(params.getName(), params.getHandler(), args, null);
            logger.info("Enqueued job " + job.getId() + ": " + params);
            return Optional.of(job);
        } catch (DuplicateJobException e) {
            logger.warning("Duplicate job already in queue for: " + params);
            return Optional.empty();
        }
    }

    /**
     * Create a job that becomes eligible after {@code delaySeconds}. Delayed jobs are not
     * de-duplicated by name.
     *
     * @throws IllegalArgumentException if the name or handler is blank, or the delay is negative
     * @throws SQLException if the store fails
     */
    public Job enqueueIn(long delaySeconds, JobParams params) throws SQLException {
        validate(params);
        if (delaySeconds < 0) {
            throw new IllegalArgumentException("Delay must not be negative: " + delaySeconds);
        }

        LocalDateTime runAfter = LocalDateTime.now().plusSeconds(delaySeconds);
        Job job = store.createJob(params.getName(), params.getHandler(), JobArgs.toJson(params.getArgs()), runAfter);
        logger.info("Scheduled job " + job.getId() + " to run after " + runAfter + ": " + params);
        return job;
    }

    private static void validate(JobParams params) {
        if (params == null || isBlank(params.getName()) || isBlank(params.getHandler())) {
            throw new IllegalArgumentException("Both a name and a handler are required for a job");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        for (Worker worker : workers) {
            worker.start();
        }
        stuckJobRequeuer.start();
        scheduledJobRequeuer.start();

        logger.info("Worker pool started");
    }

    /**
     * Stop every worker and both requeuers. Returns after all of them have exited; a handler
     * that is running is allowed to finish first.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        logger.info("Stopping worker pool...");

        for (Worker worker : workers) {
            worker.signalStop();
        }
        stuckJobRequeuer.signalStop();
        scheduledJobRequeuer.signalStop();

        for (Worker worker : workers) {
            worker.awaitStopped();
        }
        stuckJobRequeuer.awaitStopped();
        scheduledJobRequeuer.awaitStopped();

        logger.info("Worker pool stopped");
    }

    public boolean isStarted() {
        return started.get();
    }

    public int getConcurrency() {
        return workers.size();
    }

    public boolean hasHandler(String name) {
        return handlers.containsKey(name);
    }

    List<Worker> getWorkers() {
        return Collections.unmodifiableList(workers);
    }
}
