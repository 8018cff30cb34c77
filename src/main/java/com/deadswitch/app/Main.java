package com.deadswitch.app;

import com.deadswitch.config.ServiceConfig;
import com.deadswitch.core.JobStatus;
import com.deadswitch.core.ProbeStatus;
import com.deadswitch.db.Database;
import com.deadswitch.db.JobRepository;
import com.deadswitch.db.ProbeRepository;
import com.deadswitch.db.UserRepository;
import com.deadswitch.engine.PeriodicScheduler;
import com.deadswitch.engine.WorkerPool;
import com.deadswitch.probe.LoggingMessenger;
import com.deadswitch.probe.ProbeReplyHandler;
import com.deadswitch.probe.ProbeScheduler;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Main application entry point for the dead man's switch service.
 * Wires all components, starts the worker pool and the probe schedules, and runs until the JVM
 * is asked to shut down.
 */
public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());

    private static final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public static void main(String[] args) {
        configureLogging();
        logger.info("=== Dead man's switch starting ===");

        try {
            ServiceConfig config = ServiceConfig.load();
            logger.info("Loaded " + config);

            // 1. Database
            Database database = new Database(config.getDbUrl(), config.getDbUser(), config.getDbPassword(),
                    config.getDbPoolSize());
            database.initialize();

            JobRepository jobRepository = new JobRepository(database);
            UserRepository userRepository = new UserRepository(database, config.getDefaultProbeCron());
            ProbeRepository probeRepository = new ProbeRepository(database);

            // 2. Queue and schedules
            WorkerPool pool = new WorkerPool(jobRepository, config);
            PeriodicScheduler periodicScheduler = new PeriodicScheduler(pool, config.getTimeZone());
            ProbeScheduler probeScheduler = new ProbeScheduler(pool, periodicScheduler, userRepository,
                    probeRepository, new LoggingMessenger(), config, Clock.systemDefaultZone());
            ProbeReplyHandler replyHandler = new ProbeReplyHandler(userRepository, probeRepository, pool);

            // 3. Start
            pool.start();
            probeScheduler.scheduleProbes();
            periodicScheduler.start();

            logStats(jobRepository, probeRepository);

            // Replies are typed on stdin as "<phone number> <message>"
            Thread console = new Thread(new ReplyConsole(replyHandler,
                    new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))), "reply-console");
            console.setDaemon(true);
            console.start();

            // 4. Graceful shutdown
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutdown signal received");
                periodicScheduler.stop();
                pool.stop();
                database.close();
                logger.info("=== Dead man's switch stopped ===");
                shutdownLatch.countDown();
            }, "Shutdown-Hook"));

            logger.info("=== Dead man's switch is running ===");
            logger.info("Press Ctrl+C to stop");

            shutdownLatch.await();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted");
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Fatal error during startup", e);
            System.exit(1);
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to load logging.properties, using JVM defaults", e);
        }
    }

    private static void logStats(JobRepository jobRepository, ProbeRepository probeRepository) {
        try {
            Map<JobStatus, Integer> jobs = jobRepository.countByStatus();
            Map<ProbeStatus, Integer> probes = probeRepository.countByStatus();
            logger.info("Jobs by status: " + jobs);
            logger.info("Probes by status: " + probes);
        } catch (Exception e) {
            logger.log(Level.WARNING, "Failed to read startup stats", e);
        }
    }
}
