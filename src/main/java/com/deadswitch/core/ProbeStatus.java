package com.deadswitch.core;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of a liveliness probe.
 *
 * <p>A probe starts PENDING. A reply moves it to GOOD or BAD, the escalation sweep
 * moves it to UNAVAILABLE and disabling probing moves it to CANCELLED. All four are terminal.</p>
 */
public enum ProbeStatus {
    PENDING("pending"),
    GOOD("good"),
    BAD("bad"),
    UNAVAILABLE("unavailable"),
    CANCELLED("cancelled");

    private static final Set<String> GOOD_RESPONSES = Set.of("yes", "yeah", "yh", "y");
    private static final Set<String> BAD_RESPONSES = Set.of("no", "nope", "nah", "na", "n");

    private final String dbName;

    ProbeStatus(String dbName) {
        this.dbName = dbName;
    }

    public String getDbName() {
        return dbName;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Map a free-text reply onto GOOD or BAD. Matching ignores case and surrounding whitespace.
     *
     * @param response the reply as received
     * @return GOOD or BAD, or empty if the reply is outside the vocabulary
     */
    public static Optional<ProbeStatus> fromResponse(String response) {
        if (response == null) {
            return Optional.empty();
        }
        String normalized = response.trim().toLowerCase(Locale.ROOT);
        if (GOOD_RESPONSES.contains(normalized)) {
            return Optional.of(GOOD);
        }
        if (BAD_RESPONSES.contains(normalized)) {
            return Optional.of(BAD);
        }
        return Optional.empty();
    }

    public static ProbeStatus fromDbName(String dbName) {
        for (ProbeStatus status : values()) {
            if (status.dbName.equals(dbName)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown probe status: " + dbName);
    }

    @Override
    public String toString() {
        return dbName;
    }
}
