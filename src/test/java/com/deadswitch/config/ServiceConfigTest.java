package com.deadswitch.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class ServiceConfigTest {

    @AfterEach
    public void tearDown() {
        System.clearProperty("deadswitch.worker.concurrency");
    }

    @Test
    public void testDefaults() {
        ServiceConfig config = ServiceConfig.fromProperties(new Properties());

        assertEquals(2, config.getWorkerConcurrency());
        assertEquals(4, config.getMaxFails());
        assertEquals(List.of(Duration.ZERO, Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(5),
                Duration.ofSeconds(15), Duration.ofSeconds(30)), config.getPollBackoff());
        assertEquals(Duration.ofMillis(5), config.getWorkerTick());
        assertEquals(Duration.ofMillis(10), config.getWorkerErrorTick());
        assertEquals(30, config.getStaleAfterMinutes());
        assertEquals(Duration.ofMinutes(30), config.getReaperIdle());
        assertEquals(ZoneId.of("UTC"), config.getTimeZone());
        assertEquals(3, config.getMaxProbeRetries());
        assertEquals(Duration.ofMinutes(30), config.getFollowUpInterval());
        assertEquals("0 0 18 * * WED", config.getDefaultProbeCron());
    }

    @Test
    public void testClasspathFileAndSystemOverride() {
        System.setProperty("deadswitch.worker.concurrency", "7");

        ServiceConfig config = ServiceConfig.load();

        assertEquals(7, config.getWorkerConcurrency());
        assertEquals(10, config.getDbPoolSize());
    }

    @Test
    public void testBadValuesAreRejected() {
        Properties notNumber = new Properties();
        notNumber.setProperty("worker.concurrency", "many");
        assertThrows(IllegalArgumentException.class, () -> ServiceConfig.fromProperties(notNumber));

        Properties zero = new Properties();
        zero.setProperty("worker.max.fails", "0");
        assertThrows(IllegalArgumentException.class, () -> ServiceConfig.fromProperties(zero));

        Properties negativeWait = new Properties();
        negativeWait.setProperty("worker.poll.backoff.ms", "0,-5");
        assertThrows(IllegalArgumentException.class, () -> ServiceConfig.fromProperties(negativeWait));

        Properties decreasingLadder = new Properties();
        decreasingLadder.setProperty("worker.poll.backoff.ms", "30000,1000,0");
        assertThrows(IllegalArgumentException.class, () -> ServiceConfig.fromProperties(decreasingLadder));

        Properties emptyLadder = new Properties();
        emptyLadder.setProperty("worker.poll.backoff.ms", " , ");
        assertThrows(IllegalArgumentException.class, () -> ServiceConfig.fromProperties(emptyLadder));

        Properties badZone = new Properties();
        badZone.setProperty("scheduler.timezone", "Mars/Olympus");
        assertThrows(IllegalArgumentException.class, () -> ServiceConfig.fromProperties(badZone));
    }
}
