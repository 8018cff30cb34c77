package com.deadswitch.probe;

import java.util.logging.Logger;

/**
 * Development messenger: writes every message to the log and reports success.
 */
public class LoggingMessenger implements Messenger {
    private static final Logger logger = Logger.getLogger(LoggingMessenger.class.getName());

    @Override
    public void send(String destination, String text) {
        logger.info("[message to " + destination + "] " + text);
    }
}
