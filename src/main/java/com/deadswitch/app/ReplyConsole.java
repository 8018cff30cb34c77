package com.deadswitch.app;

import com.deadswitch.probe.ProbeReplyHandler;

import java.io.BufferedReader;
import java.io.IOException;
import java.sql.SQLException;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Development stand-in for the inbound SMS webhook. Each line read is
 * {@code <phone number> <message>} and is handed to the {@link ProbeReplyHandler};
 * the answer is logged the way {@link com.deadswitch.probe.LoggingMessenger} logs outbound texts.
 */
public class ReplyConsole implements Runnable {
    private static final Logger logger = Logger.getLogger(ReplyConsole.class.getName());

    private final ProbeReplyHandler replyHandler;
    private final BufferedReader in;

    public ReplyConsole(ProbeReplyHandler replyHandler, BufferedReader in) {
        this.replyHandler = replyHandler;
        this.in = in;
    }

    @Override
    public void run() {
        try {
            String line;
            while ((line = in.readLine()) != null) {
                handleLine(line).ifPresent(answer -> logger.info("[reply] " + answer));
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Reply console stopped reading", e);
        }
    }

    /**
     * Handle one input line.
     *
     * @return the answer to send back, or empty when there is none or the line is malformed
     */
    Optional<String> handleLine(String line) {
        String trimmed = line.trim();
        int split = trimmed.indexOf(' ');
        if (split <= 0) {
            if (!trimmed.isEmpty()) {
                logger.warning("Expected '<phone number> <message>', got: " + trimmed);
            }
            return Optional.empty();
        }

        String phoneNumber = trimmed.substring(0, split);
        String message = trimmed.substring(split + 1);
        try {
            return replyHandler.handleReply(phoneNumber, message);
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to handle reply from " + phoneNumber, e);
            return Optional.empty();
        }
    }
}
