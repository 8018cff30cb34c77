package com.deadswitch.probe;

/**
 * Thrown when a message could not be sent.
 */
public class MessagingException extends Exception {

    public MessagingException(String message) {
        super(message);
    }

    public MessagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
