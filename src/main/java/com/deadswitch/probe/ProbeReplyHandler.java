package com.deadswitch.probe;

import com.deadswitch.core.Probe;
import com.deadswitch.core.ProbeStatus;
import com.deadswitch.core.User;
import com.deadswitch.db.ProbeRepository;
import com.deadswitch.db.UserRepository;
import com.deadswitch.engine.WorkerPool;

import java.sql.SQLException;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Resolves pending probes from inbound text replies.
 *
 * <p>Only the user's latest probe is considered, and only while it is pending. The status
 * change is conditional on that, so a reply arriving after escalation (or a second reply to
 * the same probe) changes nothing.</p>
 */
public class ProbeReplyHandler {
    private static final Logger logger = Logger.getLogger(ProbeReplyHandler.class.getName());

    static final String PING_COMMAND = "ping";
    static final String PONG = "PONG!";
    static final String GOOD_REPLY = "👍";
    static final String BAD_REPLY = "Hang in there! Reaching out to your emergency contact ASAP.";

    private final UserRepository users;
    private final ProbeRepository probes;
    private final WorkerPool pool;

    public ProbeReplyHandler(UserRepository users, ProbeRepository probes, WorkerPool pool) {
        this.users = users;
        this.probes = probes;
        this.pool = pool;
    }

    /**
     * Handle a message received from {@code fromPhoneNumber}.
     *
     * @return the text to answer with, or empty to stay silent
     */
    public Optional<String> handleReply(String fromPhoneNumber, String message) throws SQLException {
        Optional<User> user = users.findUserByPhone(fromPhoneNumber);
        if (user.isEmpty()) {
            logger.fine("Ignoring message from unknown number " + fromPhoneNumber);
            return Optional.empty();
        }

        String text = message == null ? "" : message.trim();
        if (PING_COMMAND.equalsIgnoreCase(text)) {
            return Optional.of(PONG);
        }

        long userId = user.get().getId();
        Optional<Probe> lastProbe = probes.lastProbeForUser(userId);
        if (lastProbe.isEmpty() || !lastProbe.get().isPending()) {
            logger.fine("No pending probe for user " + userId + ", ignoring reply");
            return Optional.empty();
        }

        Probe probe = lastProbe.get();
        Optional<ProbeStatus> status = ProbeStatus.fromResponse(text);
        if (status.isEmpty()) {
            probes.saveLastResponse(probe.getId(), text);
            logger.info("Reply from user " + userId + " did not resolve probe " + probe.getId());
            return Optional.empty();
        }

        if (!probes.setStatusIfPending(probe.getId(), status.get(), text)) {
            logger.info("Probe " + probe.getId() + " was resolved before the reply from user " + userId);
            return Optional.empty();
        }

        logger.info("Probe " + probe.getId() + " of user " + userId + " resolved as " + status.get());

        if (status.get() == ProbeStatus.BAD) {
            pool.enqueue(ProbeScheduler.emergencyProbeParams(userId, probe.getId()));
            return Optional.of(BAD_REPLY);
        }
        return Optional.of(GOOD_REPLY);
    }
}
