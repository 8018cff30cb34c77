package com.deadswitch.probe;

import com.deadswitch.config.ServiceConfig;
import com.deadswitch.core.Contact;
import com.deadswitch.core.JobArgs;
import com.deadswitch.core.JobParams;
import com.deadswitch.core.Probe;
import com.deadswitch.core.ProbeSetting;
import com.deadswitch.core.ProbeStatus;
import com.deadswitch.core.User;
import com.deadswitch.db.ProbeRepository;
import com.deadswitch.db.UserRepository;
import com.deadswitch.engine.PeriodicScheduler;
import com.deadswitch.engine.WorkerPool;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Liveliness probe lifecycle on top of the job queue.
 *
 * <p><b>Flow:</b></p>
 * <ol>
 *   <li>Every user with active probe settings gets a cron trigger (tag {@code probe_<userId>})
 *       that enqueues a unique {@code send_liveliness_probe_<userId>} job.</li>
 *   <li>That job messages the user and records a PENDING probe, unless one is still pending.</li>
 *   <li>The {@code sweep_pending_probes} job runs on a fixed interval and, for each pending probe,
 *       either sends a follow-up or escalates to the user's emergency contact.</li>
 *   <li>A reply resolves the probe (see {@link ProbeReplyHandler}).</li>
 * </ol>
 *
 * <p><b>Follow-up timing:</b> follow-up {@code n} (counting from 1) goes out no earlier than
 * {@code n} hours after the previous message, so with an initial probe at 17:00 the follow-ups
 * come at about 18:00, 20:00 and 23:00. Once the configured number of follow-ups went
 * unanswered the next sweep escalates.</p>
 *
 * <p>Handlers are registered with the pool on construction.</p>
 */
public class ProbeScheduler {
    private static final Logger logger = Logger.getLogger(ProbeScheduler.class.getName());

    public static final String SEND_LIVELINESS_PROBE_HANDLER = "send_liveliness_probe";
    public static final String SWEEP_PENDING_PROBES_HANDLER = "sweep_pending_probes";
    public static final String SEND_EMERGENCY_PROBE_HANDLER = "send_emergency_probe";

    public static final String FOLLOW_UP_TAG = "follow_up_probes";

    private final WorkerPool pool;
    private final PeriodicScheduler periodicScheduler;
    private final UserRepository users;
    private final ProbeRepository probes;
    private final Messenger messenger;
    private final Clock clock;
    private final int maxProbeRetries;
    private final Duration followUpInterval;

    public ProbeScheduler(WorkerPool pool, PeriodicScheduler periodicScheduler, UserRepository users,
                          ProbeRepository probes, Messenger messenger, ServiceConfig config, Clock clock) {
        this.pool = pool;
        this.periodicScheduler = periodicScheduler;
        this.users = users;
        this.probes = probes;
        this.messenger = messenger;
        this.clock = clock;
        this.maxProbeRetries = config.getMaxProbeRetries();
        this.followUpInterval = config.getFollowUpInterval();

        pool.registerHandler(SEND_LIVELINESS_PROBE_HANDLER, this::sendLivelinessProbe);
        pool.registerHandler(SWEEP_PENDING_PROBES_HANDLER, args -> sweepPendingProbes());
        pool.registerHandler(SEND_EMERGENCY_PROBE_HANDLER, this::sendEmergencyProbe);
    }

    public static String probeTag(long userId) {
        return "probe_" + userId;
    }

    public static String livelinessProbeJobName(long userId) {
        return SEND_LIVELINESS_PROBE_HANDLER + "_" + userId;
    }

    public static String emergencyProbeJobName(long userId) {
        return SEND_EMERGENCY_PROBE_HANDLER + "_" + userId;
    }

    /**
     * Params of the job that notifies the emergency contact about a probe answered negatively.
     */
    public static JobParams emergencyProbeParams(long userId, long probeId) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("user_id", userId);
        args.put("probe_id", probeId);
        return new JobParams(emergencyProbeJobName(userId), SEND_EMERGENCY_PROBE_HANDLER, args, true);
    }

    /**
     * Register the probe trigger of every user with active settings, plus the follow-up sweep.
     *
     * @return the number of users scheduled
     */
    public int scheduleProbes() throws SQLException {
        List<User> active = users.usersWithActiveProbe();
        for (User user : active) {
            periodicallyPerformProbe(user);
        }
        logger.info(active.size() + " liveliness probe(s) cron scheduled");

        periodicScheduler.scheduleEvery(followUpInterval, FOLLOW_UP_TAG,
                new JobParams(SWEEP_PENDING_PROBES_HANDLER, SWEEP_PENDING_PROBES_HANDLER, Map.of(), true));

        return active.size();
    }

    /**
     * (Re)register the user's probe trigger from their current settings.
     *
     * @throws IllegalArgumentException if the stored cron expression is invalid
     */
    public void periodicallyPerformProbe(User user) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("user_id", user.getId());
        args.put("first_name", user.getFirstName());
        args.put("last_name", user.getLastName());

        periodicScheduler.scheduleCron(
                user.getProbeSetting().getCronExpression(),
                probeTag(user.getId()),
                new JobParams(livelinessProbeJobName(user.getId()), SEND_LIVELINESS_PROBE_HANDLER, args, true));
    }

    /**
     * Change a user's probe settings and apply them to the schedule.
     *
     * @param active new state, or null to keep the current one
     * @param cronExpression new schedule, or null to keep the current one
     * @return the stored settings
     * @throws IllegalArgumentException if the user does not exist or the cron expression is invalid
     * @throws IllegalStateException if probing would be active without an emergency contact
     */
    public ProbeSetting updateProbeSettings(long userId, Boolean active, String cronExpression) throws SQLException {
        User user = users.findUser(userId)
                .orElseThrow(() -> new IllegalArgumentException("No user with id " + userId));
        ProbeSetting current = user.getProbeSetting();

        String cron = cronExpression != null ? cronExpression.trim() : current.getCronExpression();
        PeriodicScheduler.validate(cron);

        boolean enable = active != null ? active : current.isActive();
        if (enable && users.emergencyContact(userId).isEmpty()) {
            throw new IllegalStateException("An emergency contact is required to enable probing for user " + userId);
        }

        ProbeSetting updated = users.updateProbeSettings(userId, enable, cron);
        if (updated.isActive()) {
            user.setProbeSetting(updated);
            periodicallyPerformProbe(user);
        } else {
            disablePeriodicProbe(userId);
        }

        logger.info("Probe settings updated for user " + userId + ": " + updated);
        return updated;
    }

    /**
     * Stop probing the user: drop their trigger and cancel whatever probe is pending.
     *
     * @return the number of probes cancelled
     */
    public int disablePeriodicProbe(long userId) throws SQLException {
        periodicScheduler.removeByTag(probeTag(userId));
        return probes.cancelAllPendingProbes(userId);
    }

    void sendLivelinessProbe(Map<String, Object> args) throws SQLException, MessagingException {
        long userId = JobArgs.getLong(args, "user_id");

        Optional<User> found = users.findUser(userId);
        if (found.isEmpty()) {
            logger.warning("Skipping liveliness probe, user " + userId + " ("
                    + JobArgs.getString(args, "first_name", "unknown") + ") no longer exists");
            return;
        }

        User user = found.get();
        if (!user.getProbeSetting().isActive()) {
            logger.info("Skipping liveliness probe for user " + userId + ", probing is disabled");
            return;
        }

        Optional<Probe> lastProbe = probes.lastProbeForUser(userId);
        if (lastProbe.isPresent() && lastProbe.get().isPending()) {
            logger.info("Skipping liveliness probe for user " + userId + ", probe " + lastProbe.get().getId()
                    + " is still pending");
            return;
        }

        messenger.send(user.getPhoneNumber(), "Are you okay " + titleCase(user.getFirstName()) + "?");

        Probe probe = probes.createPendingProbe(userId);
        logger.info("Liveliness probe " + probe.getId() + " sent to user " + userId);
    }

    void sweepPendingProbes() throws SQLException {
        List<Probe> pending = probes.probesByStatus(ProbeStatus.PENDING);
        int followUps = 0;
        int escalations = 0;

        for (Probe probe : pending) {
            try {
                if (probe.getRetryCount() >= maxProbeRetries) {
                    if (escalate(probe)) {
                        escalations++;
                    }
                } else if (sendFollowUp(probe)) {
                    followUps++;
                }
            } catch (SQLException | MessagingException | RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to handle pending probe " + probe.getId(), e);
            }
        }

        logger.info(pending.size() + " pending probe(s) found, " + followUps + " follow-up(s) sent, "
                + escalations + " escalated");
    }

    private boolean sendFollowUp(Probe probe) throws SQLException, MessagingException {
        Duration waited = Duration.between(probe.getUpdatedAt(), LocalDateTime.now(clock));
        if (waited.compareTo(Duration.ofHours(probe.getRetryCount() + 1L)) < 0) {
            return false;
        }

        Optional<User> user = users.findUser(probe.getUserId());
        if (user.isEmpty()) {
            logger.warning("Pending probe " + probe.getId() + " belongs to missing user " + probe.getUserId());
            return false;
        }

        messenger.send(user.get().getPhoneNumber(), "Are you okay " + titleCase(user.get().getFirstName()) + "??");

        if (!probes.incrementRetryCount(probe.getId())) {
            logger.info("Probe " + probe.getId() + " was resolved while its follow-up was being sent");
            return false;
        }
        return true;
    }

    // Marks the probe unavailable first so a late reply cannot race the escalation
    private boolean escalate(Probe probe) throws SQLException {
        if (!probes.setStatusIfPending(probe.getId(), ProbeStatus.UNAVAILABLE, null)) {
            logger.info("Probe " + probe.getId() + " was resolved before escalation");
            return false;
        }

        Optional<User> user = users.findUser(probe.getUserId());
        Optional<Contact> contact = users.emergencyContact(probe.getUserId());
        if (user.isEmpty() || contact.isEmpty()) {
            logger.warning("Probe " + probe.getId() + " is unavailable but user " + probe.getUserId()
                    + " has no emergency contact to notify");
            return true;
        }

        boolean delivered = notifyEmergencyContact(user.get(), contact.get());
        probes.createEmergencyProbe(probe.getId(), contact.get().getId(), delivered);
        return true;
    }

    private boolean notifyEmergencyContact(User user, Contact contact) {
        try {
            messenger.send(contact.getPhoneNumber(), emergencyMessage(user, contact));
            logger.info("Emergency contact " + contact.getId() + " notified about user " + user.getId());
            return true;
        } catch (MessagingException e) {
            logger.log(Level.SEVERE, "Failed to notify emergency contact " + contact.getId()
                    + " about user " + user.getId(), e);
            return false;
        }
    }

    void sendEmergencyProbe(Map<String, Object> args) throws SQLException, MessagingException {
        long userId = JobArgs.getLong(args, "user_id");
        long probeId = JobArgs.getLong(args, "probe_id");

        if (!probes.emergencyProbesFor(probeId).isEmpty()) {
            logger.info("Emergency contact already notified for probe " + probeId);
            return;
        }

        Optional<User> user = users.findUser(userId);
        Optional<Contact> contact = users.emergencyContact(userId);
        if (user.isEmpty() || contact.isEmpty()) {
            logger.warning("No emergency contact to notify for user " + userId + " (probe " + probeId + ")");
            return;
        }

        messenger.send(contact.get().getPhoneNumber(), emergencyMessage(user.get(), contact.get()));
        probes.createEmergencyProbe(probeId, contact.get().getId(), true);
        logger.info("Emergency contact " + contact.get().getId() + " notified about probe " + probeId);
    }

    static String emergencyMessage(User user, Contact contact) {
        String name = titleCase(user.getFirstName());
        return "Hi " + titleCase(contact.getFirstName()) + ",\n"
                + "you're getting this message because you're " + name + "'s emergency contact.\n"
                + name + " missed their last routine check in, can you please reach out to " + name + "\n"
                + "and make sure they're okay?\n"
                + "Thanks";
    }

    static String titleCase(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        StringBuilder result = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toCharArray()) {
            if (Character.isWhitespace(c)) {
                startOfWord = true;
                result.append(c);
            } else if (startOfWord) {
                result.append(String.valueOf(c).toUpperCase(Locale.ROOT));
                startOfWord = false;
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }
}
