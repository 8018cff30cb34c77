package com.deadswitch.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Service configuration.
 *
 * <p>Values are read from {@code deadswitch.properties} on the classpath; any key can be
 * overridden with a JVM system property carrying the {@code deadswitch.} prefix, e.g.
 * {@code -Ddeadswitch.worker.concurrency=4}. Missing keys fall back to the defaults below.</p>
 */
public class ServiceConfig {
    private static final Logger logger = Logger.getLogger(ServiceConfig.class.getName());

    public static final String RESOURCE_NAME = "deadswitch.properties";
    public static final String SYSTEM_PROPERTY_PREFIX = "deadswitch.";

    private final String dbUrl;
    private final String dbUser;
    private final String dbPassword;
    private final int dbPoolSize;

    private final int workerConcurrency;
    private final List<Duration> pollBackoff;
    private final Duration workerTick;
    private final Duration workerErrorTick;
    private final int maxFails;

    private final int staleAfterMinutes;
    private final Duration reaperIdle;
    private final Duration promoterIdle;
    private final ZoneId timeZone;

    private final int maxProbeRetries;
    private final Duration followUpInterval;
    private final String defaultProbeCron;

    private ServiceConfig(Properties props) {
        this.dbUrl = props.getProperty("db.url", "jdbc:h2:./deadswitch;AUTO_SERVER=TRUE");
        this.dbUser = props.getProperty("db.user", "sa");
        this.dbPassword = props.getProperty("db.password", "");
        this.dbPoolSize = positiveInt(props, "db.pool.size", 10);

        this.workerConcurrency = positiveInt(props, "worker.concurrency", 2);
        this.pollBackoff = durationList(props, "worker.poll.backoff.ms", "0,1000,2000,5000,15000,30000");
        this.workerTick = Duration.ofMillis(positiveInt(props, "worker.tick.ms", 5));
        this.workerErrorTick = Duration.ofMillis(positiveInt(props, "worker.error.tick.ms", 10));
        this.maxFails = positiveInt(props, "worker.max.fails", 4);

        this.staleAfterMinutes = positiveInt(props, "requeuer.stale.minutes", 30);
        this.reaperIdle = Duration.ofMinutes(positiveInt(props, "requeuer.idle.minutes", 30));
        this.promoterIdle = Duration.ofMillis(positiveInt(props, "scheduler.promote.idle.ms", 1000));
        this.timeZone = zone(props, "scheduler.timezone", "UTC");

        this.maxProbeRetries = positiveInt(props, "probe.max.retries", 3);
        this.followUpInterval = Duration.ofMinutes(positiveInt(props, "probe.followup.interval.minutes", 30));
        this.defaultProbeCron = props.getProperty("probe.default.cron", "0 0 18 * * WED").trim();
    }

    /**
     * Load the classpath defaults and apply system property overrides.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static ServiceConfig load() {
        Properties props = new Properties();

        try (InputStream in = ServiceConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                props.load(in);
            } else {
                logger.warning(RESOURCE_NAME + " not found on classpath, using built-in defaults");
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE_NAME, e);
        }

        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(SYSTEM_PROPERTY_PREFIX)) {
                props.setProperty(key.substring(SYSTEM_PROPERTY_PREFIX.length()), System.getProperty(key));
            }
        }

        return new ServiceConfig(props);
    }

    /**
     * Build a configuration from explicit properties; unset keys use the defaults.
     */
    public static ServiceConfig fromProperties(Properties props) {
        return new ServiceConfig(props);
    }

    private static int positiveInt(Properties props, String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 1) {
                throw new IllegalArgumentException("Config '" + key + "' must be at least 1, got " + value);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config '" + key + "' is not a number: " + raw, e);
        }
    }

    private static List<Duration> durationList(Properties props, String key, String defaultValue) {
        String raw = props.getProperty(key, defaultValue);
        List<Duration> durations = new ArrayList<>();

        for (String part : raw.split(",")) {
            if (part.isBlank()) {
                continue;
            }
            try {
                long millis = Long.parseLong(part.trim());
                if (millis < 0) {
                    throw new IllegalArgumentException("Config '" + key + "' has a negative entry: " + millis);
                }
                if (!durations.isEmpty() && millis < durations.get(durations.size() - 1).toMillis()) {
                    throw new IllegalArgumentException("Config '" + key + "' must not decrease: " + raw);
                }
                durations.add(Duration.ofMillis(millis));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Config '" + key + "' has a bad entry: " + part, e);
            }
        }

        if (durations.isEmpty()) {
            throw new IllegalArgumentException("Config '" + key + "' must list at least one wait");
        }
        return Collections.unmodifiableList(durations);
    }

    private static ZoneId zone(Properties props, String key, String defaultValue) {
        String raw = props.getProperty(key, defaultValue).trim();
        try {
            return ZoneId.of(raw);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Config '" + key + "' is not a time zone: " + raw, e);
        }
    }

    public String getDbUrl() { return dbUrl; }
    public String getDbUser() { return dbUser; }
    public String getDbPassword() { return dbPassword; }
    public int getDbPoolSize() { return dbPoolSize; }

    /** Number of workers in the pool. */
    public int getWorkerConcurrency() { return workerConcurrency; }

    /** Waits between empty polls, in order; the last entry repeats. */
    public List<Duration> getPollBackoff() { return pollBackoff; }

    public Duration getWorkerTick() { return workerTick; }
    public Duration getWorkerErrorTick() { return workerErrorTick; }

    /** Failed attempts after which a job is marked dead. */
    public int getMaxFails() { return maxFails; }

    /** Minutes a job may stay in progress without an update before it is reaped. */
    public int getStaleAfterMinutes() { return staleAfterMinutes; }

    public Duration getReaperIdle() { return reaperIdle; }
    public Duration getPromoterIdle() { return promoterIdle; }
    public ZoneId getTimeZone() { return timeZone; }

    public int getMaxProbeRetries() { return maxProbeRetries; }
    public Duration getFollowUpInterval() { return followUpInterval; }
    public String getDefaultProbeCron() { return defaultProbeCron; }

    @Override
    public String toString() {
        return "ServiceConfig{dbUrl='" + dbUrl + "', workers=" + workerConcurrency + ", pollBackoff=" + pollBackoff
                + ", maxFails=" + maxFails + ", staleAfterMinutes=" + staleAfterMinutes + ", timeZone=" + timeZone
                + ", maxProbeRetries=" + maxProbeRetries + ", followUpInterval=" + followUpInterval + "}";
    }
}
