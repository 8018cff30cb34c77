package com.deadswitch.engine;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A background loop on its own thread that repeatedly runs one poll and then waits for
 * the delay the poll asked for.
 *
 * <p><b>Stopping:</b> the wait is on a stop latch, so a loop sitting out a long backoff
 * wakes up as soon as {@link #signalStop()} is called. A poll that is already running
 * (e.g. a job handler) is allowed to finish. {@link #awaitStopped()} blocks until the
 * thread has left the loop.</p>
 *
 * <p>A stopped loop can be started again; each start gets fresh latches.</p>
 */
abstract class PollingLoop {
    private static final Logger logger = Logger.getLogger(PollingLoop.class.getName());

    private final String name;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile CountDownLatch stopped = new CountDownLatch(0);

    protected PollingLoop(String name) {
        this.name = name;
    }

    /**
     * Run a single poll.
     *
     * @return how long to wait before the next poll
     */
    protected abstract Duration pollOnce();

    public String getName() {
        return name;
    }

    public boolean isRunning() {
        return running.get();
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            logger.warning(name + " is already running");
            return;
        }

        stopSignal = new CountDownLatch(1);
        stopped = new CountDownLatch(1);

        Thread thread = new Thread(this::loop, name);
        thread.setDaemon(false);
        thread.start();
    }

    /**
     * Ask the loop to exit without waiting for it.
     */
    public void signalStop() {
        stopSignal.countDown();
    }

    /**
     * Block until the loop thread has exited. Returns immediately if it never started.
     */
    public void awaitStopped() {
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning("Interrupted while waiting for " + name + " to stop");
        }
    }

    public void stop() {
        signalStop();
        awaitStopped();
    }

    private void loop() {
        CountDownLatch signal = stopSignal;
        CountDownLatch done = stopped;
        logger.info("Starting " + name);

        try {
            Duration wait = Duration.ZERO;
            while (!signal.await(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                try {
                    wait = pollOnce();
                } catch (VirtualMachineError e) {
                    throw e;
                } catch (RuntimeException | Error e) {
                    logger.log(Level.SEVERE, "Unexpected error in " + name, e);
                    wait = errorWait();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning(name + " interrupted");
        } finally {
            logger.info("Stopping " + name);
            running.set(false);
            done.countDown();
        }
    }

    /**
     * Wait applied after an unexpected exception escapes {@link #pollOnce()}.
     */
    protected abstract Duration errorWait();
}
