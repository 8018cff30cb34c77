package com.deadswitch.engine;

import com.deadswitch.config.ServiceConfig;
import com.deadswitch.core.Job;
import com.deadswitch.core.JobStatus;
import com.deadswitch.db.Database;
import com.deadswitch.db.JobRepository;
import com.deadswitch.db.JobUpdate;
import com.deadswitch.testing.Await;
import com.deadswitch.testing.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

public class RequeuerTest {

    private Database database;
    private JobRepository store;
    private ServiceConfig config;

    @BeforeEach
    public void setUp() throws Exception {
        database = TestDatabases.newDatabase();
        store = new JobRepository(database);
        config = TestDatabases.fastConfig();
    }

    @AfterEach
    public void tearDown() {
        TestDatabases.destroy(database);
    }

    @Test
    public void testStuckJobIsRequeuedOnce() throws Exception {
        Requeuer reaper = new Requeuer(Requeuer.Source.STUCK, store, config);
        assertEquals("stuck-job-requeuer", reaper.getName());
        assertEquals(Requeuer.Source.STUCK, reaper.getSource());

        Job job = store.createJob("slow", "handler", "{}", null);
        assertTrue(store.claim(job.getId()));
        store.update(job.getId(), new JobUpdate().fails(2));

        // recently claimed jobs are left alone
        assertFalse(reaper.requeueNext());

        TestDatabases.backdateJob(database, job.getId(), config.getStaleAfterMinutes() + 5);
        assertTrue(reaper.requeueNext());
        assertFalse(reaper.requeueNext());

        Job requeued = store.findJob(job.getId()).orElseThrow();
        assertEquals(JobStatus.ENQUEUED, requeued.getStatus());
        assertFalse(requeued.isClaimed());
        assertEquals(2, requeued.getFails());
    }

    @Test
    public void testIdleAndTickWaits() throws Exception {
        Requeuer reaper = new Requeuer(Requeuer.Source.STUCK, store, config);
        assertEquals(config.getReaperIdle(), reaper.pollOnce());

        Job job = store.createJob("slow", "handler", "{}", null);
        store.claim(job.getId());
        TestDatabases.backdateJob(database, job.getId(), config.getStaleAfterMinutes() + 5);

        assertEquals(config.getWorkerTick(), reaper.pollOnce());
    }

    @Test
    public void testScheduledJobIsPromotedWhenDue() throws Exception {
        Requeuer promoter = new Requeuer(Requeuer.Source.SCHEDULED, store, config);
        assertEquals("scheduled-job-requeuer", promoter.getName());

        Job later = store.createJob("later", "handler", "{}", LocalDateTime.now().plusHours(1));
        Job soon = store.createJob("soon", "handler", "{}", LocalDateTime.now().plusSeconds(1));

        assertFalse(promoter.requeueNext());

        promoter.start();
        try {
            assertTrue(Await.until(
                    () -> store.findJob(soon.getId()).orElseThrow().getStatus() == JobStatus.ENQUEUED,
                    Duration.ofSeconds(5)));
        } finally {
            promoter.stop();
        }

        assertEquals(JobStatus.SCHEDULED, store.findJob(later.getId()).orElseThrow().getStatus());
    }

    @Test
    public void testRestartAfterStop() throws Exception {
        Requeuer promoter = new Requeuer(Requeuer.Source.SCHEDULED, store, config);

        promoter.start();
        promoter.stop();
        assertFalse(promoter.isRunning());

        Job soon = store.createJob("soon", "handler", "{}", LocalDateTime.now().plusSeconds(1));
        promoter.start();
        try {
            assertTrue(Await.until(
                    () -> store.findJob(soon.getId()).orElseThrow().getStatus() == JobStatus.ENQUEUED,
                    Duration.ofSeconds(5)));
        } finally {
            promoter.stop();
        }
    }
}
