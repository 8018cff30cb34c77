package com.deadswitch.engine;

import com.deadswitch.core.JobParams;
import com.deadswitch.db.Database;
import com.deadswitch.db.JobRepository;
import com.deadswitch.testing.Await;
import com.deadswitch.testing.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class PeriodicSchedulerTest {

    private Database database;
    private JobRepository store;
    private WorkerPool pool;
    private PeriodicScheduler scheduler;

    @BeforeEach
    public void setUp() throws Exception {
        database = TestDatabases.newDatabase();
        store = new JobRepository(database);
        pool = new WorkerPool(store, TestDatabases.fastConfig());
        scheduler = new PeriodicScheduler(pool, ZoneId.of("UTC"));
    }

    @AfterEach
    public void tearDown() {
        scheduler.stop();
        pool.stop();
        TestDatabases.destroy(database);
    }

    @Test
    public void testCronTriggerEnqueuesOnEveryFire() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        pool.registerHandler("tick", args -> runs.incrementAndGet());
        pool.start();

        scheduler.scheduleCron("* * * * * *", "every_second", new JobParams("tick", "tick", null, true));
        scheduler.start();

        assertTrue(Await.until(() -> runs.get() >= 3, Duration.ofSeconds(8)));
    }

    @Test
    public void testRegisteringTagAgainReplacesTrigger() throws Exception {
        scheduler.start();
        scheduler.scheduleCron("0 0 18 * * WED", "probe_1", new JobParams("a", "a", null, true));
        scheduler.scheduleCron("* * * * * *", "probe_1", new JobParams("b", "b", Map.of("n", 1), true));

        assertTrue(Await.until(() -> !store.jobsByName("b").isEmpty(), Duration.ofSeconds(5)));
        assertTrue(store.jobsByName("a").isEmpty());
        assertTrue(scheduler.hasTag("probe_1"));
    }

    @Test
    public void testRemovedTriggerStopsFiring() throws Exception {
        scheduler.scheduleCron("* * * * * *", "tick", new JobParams("tick", "tick", null, false));
        scheduler.start();
        assertTrue(Await.until(() -> !store.jobsByName("tick").isEmpty(), Duration.ofSeconds(5)));

        assertTrue(scheduler.removeByTag("tick"));
        assertFalse(scheduler.removeByTag("tick"));
        assertFalse(scheduler.hasTag("tick"));

        Thread.sleep(200);
        int count = store.jobsByName("tick").size();
        Thread.sleep(2200);
        assertEquals(count, store.jobsByName("tick").size());
    }

    @Test
    public void testEveryFiresImmediately() throws Exception {
        scheduler.start();
        scheduler.scheduleEvery(Duration.ofHours(1), "sweep", new JobParams("sweep", "sweep", null, true));

        assertTrue(Await.until(() -> store.jobsByName("sweep").size() == 1, Duration.ofSeconds(5)));
    }

    @Test
    public void testTriggersSurviveRestart() throws Exception {
        scheduler.scheduleEvery(Duration.ofHours(1), "sweep", new JobParams("sweep", "sweep", null, false));
        scheduler.start();
        assertTrue(Await.until(() -> store.jobsByName("sweep").size() == 1, Duration.ofSeconds(5)));

        scheduler.stop();
        assertFalse(scheduler.isRunning());
        assertTrue(scheduler.hasTag("sweep"));

        scheduler.start();
        assertTrue(Await.until(() -> store.jobsByName("sweep").size() == 2, Duration.ofSeconds(5)));
    }

    @Test
    public void testInvalidCronRejected() {
        JobParams params = new JobParams("x", "x", null, true);

        assertThrows(IllegalArgumentException.class, () -> scheduler.scheduleCron("not a cron", "x", params));
        assertThrows(IllegalArgumentException.class, () -> scheduler.scheduleCron("61 * * * * *", "x", params));
        assertThrows(IllegalArgumentException.class, () -> scheduler.scheduleCron("", "x", params));
        assertThrows(IllegalArgumentException.class, () -> scheduler.scheduleEvery(Duration.ZERO, "x", params));
        assertFalse(scheduler.hasTag("x"));
    }

    @Test
    public void testMissedIntervalFiresOnceNotPerSlot() {
        ZonedDateTime last = ZonedDateTime.of(2024, 1, 1, 12, 0, 0, 0, ZoneId.of("UTC"));
        Duration interval = Duration.ofMinutes(30);

        assertEquals(last.plusMinutes(30),
                PeriodicScheduler.nextIntervalFire(last, interval, last.plusMinutes(1)));

        ZonedDateTime afterPause = last.plusHours(5);
        assertEquals(afterPause, PeriodicScheduler.nextIntervalFire(last, interval, afterPause));

        ZonedDateTime now = last.plusSeconds(5);
        assertEquals(now, PeriodicScheduler.nextIntervalFire(null, interval, now));
    }

    @Test
    public void testNormalize() {
        assertEquals("0 0 18 * * WED", PeriodicScheduler.normalize("0 18 * * WED"));
        assertEquals("0 0 18 * * WED", PeriodicScheduler.normalize(" 0 0 18 * * WED "));
        assertThrows(IllegalArgumentException.class, () -> PeriodicScheduler.normalize("* * *"));
        assertDoesNotThrow(() -> PeriodicScheduler.validate("*/5 * * * *"));
    }
}
