package com.deadswitch.probe;

/**
 * Outbound text messaging, e.g. an SMS gateway.
 */
@FunctionalInterface
public interface Messenger {

    /**
     * Deliver {@code text} to {@code destination}.
     *
     * @param destination phone number of the recipient
     * @throws MessagingException if the message could not be handed to the transport
     */
    void send(String destination, String text) throws MessagingException;
}
