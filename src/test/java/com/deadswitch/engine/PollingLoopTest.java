package com.deadswitch.engine;

import com.deadswitch.testing.Await;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class PollingLoopTest {

    private static final class FlakyLoop extends PollingLoop {
        private final AtomicInteger polls = new AtomicInteger();

        private FlakyLoop() {
            super("flaky-loop");
        }

        @Override
        protected Duration pollOnce() {
            int poll = polls.incrementAndGet();
            if (poll == 1) {
                throw new AssertionError("first poll fails");
            }
            if (poll == 2) {
                throw new IllegalStateException("second poll fails");
            }
            return Duration.ofMillis(5);
        }

        @Override
        protected Duration errorWait() {
            return Duration.ofMillis(5);
        }
    }

    @Test
    public void testLoopSurvivesFailingPolls() throws Exception {
        FlakyLoop loop = new FlakyLoop();

        loop.start();
        try {
            assertTrue(Await.until(() -> loop.polls.get() >= 5, Duration.ofSeconds(5)));
            assertTrue(loop.isRunning());
        } finally {
            loop.stop();
        }
        assertFalse(loop.isRunning());
    }
}
