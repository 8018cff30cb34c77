package com.deadswitch.engine;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PollBackoffTest {

    private static final List<Duration> LADDER = List.of(
            Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(5),
            Duration.ofSeconds(15), Duration.ofSeconds(30));

    @Test
    public void testClimbsAndStaysOnLastRung() {
        PollBackoff backoff = new PollBackoff(LADDER);
        assertEquals(Duration.ofSeconds(1), backoff.current());

        Duration previous = Duration.ZERO;
        for (int i = 0; i < 10; i++) {
            Duration wait = backoff.next();
            assertTrue(wait.compareTo(previous) >= 0, "wait decreased at miss " + i);
            assertTrue(wait.compareTo(Duration.ofSeconds(30)) <= 0);
            previous = wait;
        }
        assertEquals(Duration.ofSeconds(30), backoff.current());
    }

    @Test
    public void testFirstMissMovesOneRung() {
        PollBackoff backoff = new PollBackoff(LADDER);
        assertEquals(Duration.ofSeconds(2), backoff.next());
        assertEquals(Duration.ofSeconds(5), backoff.next());
    }

    @Test
    public void testResetReturnsToBottom() {
        PollBackoff backoff = new PollBackoff(LADDER);
        backoff.next();
        backoff.next();
        backoff.next();

        backoff.reset();

        assertEquals(Duration.ofSeconds(1), backoff.current());
        assertEquals(Duration.ofSeconds(2), backoff.next());
    }

    @Test
    public void testSingleRungLadder() {
        PollBackoff backoff = new PollBackoff(List.of(Duration.ofMillis(100)));
        assertEquals(Duration.ofMillis(100), backoff.next());
        assertEquals(Duration.ofMillis(100), backoff.next());
    }

    @Test
    public void testDecreasingLadderRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PollBackoff(
                List.of(Duration.ofSeconds(30), Duration.ofSeconds(1), Duration.ZERO)));
        assertDoesNotThrow(() -> new PollBackoff(List.of(Duration.ofSeconds(1), Duration.ofSeconds(1))));
    }

    @Test
    public void testEmptyLadderRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PollBackoff(List.of()));
    }
}
