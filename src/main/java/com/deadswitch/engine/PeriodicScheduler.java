package com.deadswitch.engine;

import com.deadswitch.core.JobParams;
import org.springframework.scheduling.support.CronExpression;

import java.sql.SQLException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Recurring triggers that enqueue a job on the {@link WorkerPool} every time they fire.
 *
 * <p>Each trigger is registered under a tag. Tags are unique: registering a tag again
 * replaces the old trigger, so a logical schedule never fires twice. Triggers fire on a
 * single scheduler thread; a fire only enqueues, the job itself runs on the pool.</p>
 *
 * <p><b>Cron syntax:</b> six fields with seconds first, as understood by Spring's
 * {@link CronExpression} (e.g. {@code "0 0 18 * * WED"}). Classic five-field expressions
 * are accepted and run at second 0. Fire times are computed in the configured zone.</p>
 *
 * <p>Triggers registered before {@link #start()} are armed when it is called. {@link #stop()}
 * disarms them but keeps the registrations.</p>
 */
public class PeriodicScheduler {
    private static final Logger logger = Logger.getLogger(PeriodicScheduler.class.getName());

    private final WorkerPool pool;
    private final ZoneId zone;
    private final Map<String, Trigger> triggers = new ConcurrentHashMap<>();

    private ScheduledExecutorService executor;

    public PeriodicScheduler(WorkerPool pool, ZoneId zone) {
        this.pool = pool;
        this.zone = zone;
    }

    /**
     * Enqueue {@code params} on every fire of the cron expression.
     *
     * @throws IllegalArgumentException if the expression is invalid
     */
    public void scheduleCron(String expression, String tag, JobParams params) {
        CronExpression cron = parseCron(expression);
        register(new Trigger(tag, params, cron, null));
        logger.info("Scheduled '" + tag + "' with cron '" + expression + "'");
    }

    /**
     * Enqueue {@code params} right away and then once every {@code interval}.
     */
    public void scheduleEvery(Duration interval, String tag, JobParams params) {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Interval must be positive: " + interval);
        }
        register(new Trigger(tag, params, null, interval));
        logger.info("Scheduled '" + tag + "' every " + interval);
    }

    /**
     * Cancel the trigger registered under {@code tag}.
     *
     * @return false if no such trigger existed
     */
    public synchronized boolean removeByTag(String tag) {
        Trigger removed = triggers.remove(tag);
        if (removed == null) {
            return false;
        }
        removed.cancel();
        logger.info("Removed schedule '" + tag + "'");
        return true;
    }

    public boolean hasTag(String tag) {
        return triggers.containsKey(tag);
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }

        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "periodic-scheduler");
            thread.setDaemon(true);
            return thread;
        });

        for (Trigger trigger : triggers.values()) {
            trigger.lastTarget = null;
            arm(trigger);
        }
        logger.info("Periodic scheduler started with " + triggers.size() + " trigger(s)");
    }

    public void stop() {
        ScheduledExecutorService toStop;
        synchronized (this) {
            if (executor == null) {
                return;
            }
            toStop = executor;
            executor = null;
            for (Trigger trigger : triggers.values()) {
                trigger.disarm();
            }
        }

        toStop.shutdownNow();
        try {
            if (!toStop.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warning("Periodic scheduler did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("Periodic scheduler stopped");
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    /**
     * Bring a cron expression to the six-field form.
     *
     * @throws IllegalArgumentException if the expression has the wrong number of fields
     */
    public static String normalize(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression must not be empty");
        }

        String trimmed = expression.trim();
        int fields = trimmed.split("\\s+").length;
        if (fields == 5) {
            return "0 " + trimmed;
        }
        if (fields == 6) {
            return trimmed;
        }
        throw new IllegalArgumentException("Cron expression must have 5 or 6 fields: '" + expression + "'");
    }

    /**
     * Check that an expression can be scheduled.
     *
     * @throws IllegalArgumentException if it cannot
     */
    public static void validate(String expression) {
        parseCron(expression);
    }

    private static CronExpression parseCron(String expression) {
        String normalized = normalize(expression);
        try {
            return CronExpression.parse(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    private synchronized void register(Trigger trigger) {
        if (trigger.tag == null || trigger.tag.isBlank()) {
            throw new IllegalArgumentException("A schedule needs a tag");
        }

        Trigger previous = triggers.put(trigger.tag, trigger);
        if (previous != null) {
            previous.cancel();
            logger.info("Replaced schedule '" + trigger.tag + "'");
        }
        if (executor != null) {
            arm(trigger);
        }
    }

    // Caller holds the lock
    private void arm(Trigger trigger) {
        ZonedDateTime now = ZonedDateTime.now(zone);
        ZonedDateTime next = trigger.nextFire(now);
        if (next == null) {
            logger.warning("Schedule '" + trigger.tag + "' has no future fire time");
            return;
        }

        long delay = Math.max(0, Duration.between(now, next).toMillis());
        trigger.lastTarget = next;
        trigger.future = executor.schedule(() -> fire(trigger), delay, TimeUnit.MILLISECONDS);
        logger.fine("Schedule '" + trigger.tag + "' fires at " + next);
    }

    private void fire(Trigger trigger) {
        if (triggers.get(trigger.tag) != trigger || trigger.cancelled) {
            return;
        }

        try {
            pool.enqueue(trigger.params);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Schedule '" + trigger.tag + "' failed to enqueue " + trigger.params, e);
        }

        synchronized (this) {
            if (executor != null && !executor.isShutdown() && triggers.get(trigger.tag) == trigger && !trigger.cancelled) {
                arm(trigger);
            }
        }
    }

    // A missed interval fires once, right away, instead of once per missed slot
    static ZonedDateTime nextIntervalFire(ZonedDateTime lastTarget, Duration interval, ZonedDateTime now) {
        if (lastTarget == null) {
            return now;
        }
        ZonedDateTime next = lastTarget.plus(interval);
        return next.isBefore(now) ? now : next;
    }

    private static final class Trigger {
        private final String tag;
        private final JobParams params;
        private final CronExpression cron;
        private final Duration interval;

        private volatile ZonedDateTime lastTarget;
        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;

        private Trigger(String tag, JobParams params, CronExpression cron, Duration interval) {
            this.tag = tag;
            this.params = params;
            this.cron = cron;
            this.interval = interval;
        }

        // Starts from the previous target when the scheduler fired early, so one slot never fires twice
        private ZonedDateTime nextFire(ZonedDateTime now) {
            ZonedDateTime base = lastTarget != null && lastTarget.isAfter(now) ? lastTarget : now;
            if (cron != null) {
                return cron.next(base);
            }
            return nextIntervalFire(lastTarget, interval, now);
        }

        private void cancel() {
            cancelled = true;
            disarm();
        }

        private void disarm() {
            ScheduledFuture<?> current = future;
            if (current != null) {
                current.cancel(false);
            }
        }
    }
}
