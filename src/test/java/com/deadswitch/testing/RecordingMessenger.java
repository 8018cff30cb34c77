package com.deadswitch.testing;

import com.deadswitch.probe.MessagingException;
import com.deadswitch.probe.Messenger;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Messenger that keeps every message it was asked to send. Can be switched to fail.
 */
public class RecordingMessenger implements Messenger {

    public static final class Message {
        public final String destination;
        public final String text;

        Message(String destination, String text) {
            this.destination = destination;
            this.text = text;
        }

        @Override
        public String toString() {
            return destination + ": " + text;
        }
    }

    private final List<Message> sent = new ArrayList<>();
    private volatile boolean failing = false;

    @Override
    public synchronized void send(String destination, String text) throws MessagingException {
        if (failing) {
            throw new MessagingException("Gateway unavailable");
        }
        sent.add(new Message(destination, text));
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public synchronized List<Message> sent() {
        return new ArrayList<>(sent);
    }

    public synchronized List<String> textsTo(String destination) {
        return sent.stream()
                .filter(m -> m.destination.equals(destination))
                .map(m -> m.text)
                .collect(Collectors.toList());
    }
}
