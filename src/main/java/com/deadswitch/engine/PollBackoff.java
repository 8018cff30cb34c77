package com.deadswitch.engine;

import java.time.Duration;
import java.util.List;

/**
 * Bounded ladder of waits between empty polls.
 *
 * <p>Each miss moves one rung up; once on the last rung the wait stays there. A hit
 * resets to the bottom. With the default ladder an idle worker polls after 1s, 2s, 5s,
 * 15s and then every 30s.</p>
 *
 * <p>Not thread-safe; every worker owns its own instance.</p>
 */
public class PollBackoff {
    private final List<Duration> ladder;
    private int misses = 0;

    public PollBackoff(List<Duration> ladder) {
        if (ladder == null || ladder.isEmpty()) {
            throw new IllegalArgumentException("Backoff ladder must have at least one entry");
        }
        for (int i = 1; i < ladder.size(); i++) {
            if (ladder.get(i).compareTo(ladder.get(i - 1)) < 0) {
                throw new IllegalArgumentException("Backoff ladder must not decrease: " + ladder);
            }
        }
        this.ladder = List.copyOf(ladder);
    }

    /**
     * Record an empty poll and return how long to wait before the next one.
     * The returned waits never decrease until {@link #reset()}.
     */
    public Duration next() {
        if (misses < ladder.size() - 1) {
            misses++;
        }
        return ladder.get(misses);
    }

    public Duration current() {
        return ladder.get(misses);
    }

    public void reset() {
        misses = 0;
    }
}
