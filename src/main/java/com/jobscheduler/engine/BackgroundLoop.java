package com.jobscheduler.engine;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A long-lived worker loop with its own sleep/wake cycle.
 *
 * <p>Each pass calls {@link #runOnce()}. A pass that reports more work is
 * followed immediately by the next one; otherwise the loop sleeps for its
 * interval. Exceptions from a pass are logged and the loop backs off one
 * interval, so a store outage never ends the loop. An {@link Error} does end
 * it; {@link LoopSupervisor} restarts it.</p>
 *
 * <p>{@link #stop()} wakes a sleeping loop at once. A pass already in progress
 * finishes first.</p>
 */
public abstract class BackgroundLoop implements Runnable {
    private static final Logger logger = Logger.getLogger(BackgroundLoop.class.getName());

    private final String name;
    private final Duration interval;
    private final Object sleepMonitor = new Object();
    private volatile boolean stopRequested = false;
    private final AtomicLong passes = new AtomicLong();

    protected BackgroundLoop(String name, Duration interval) {
        this.name = name;
        this.interval = interval;
    }

    /**
     * One pass of the loop.
     *
     * @return true to run the next pass without sleeping
     * @throws Exception if the pass failed; the loop logs it and backs off
     */
    protected abstract boolean runOnce() throws Exception;

    @Override
    public void run() {
        logger.info("Loop " + name + " started (interval " + interval + ")");

        while (!stopRequested) {
            boolean moreWork = false;
            try {
                moreWork = runOnce();
                passes.incrementAndGet();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                logger.log(Level.SEVERE, "Loop " + name + " pass failed, backing off " + interval, e);
            }

            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            if (!moreWork && !pause()) {
                break;
            }
        }

        logger.info("Loop " + name + " stopped");
    }

    // Returns false when interrupted
    private boolean pause() {
        synchronized (sleepMonitor) {
            if (stopRequested) {
                return true;
            }
            try {
                sleepMonitor.wait(Math.max(1L, interval.toMillis()));
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    /**
     * Ask the loop to finish after its current pass.
     */
    public void stop() {
        stopRequested = true;
        synchronized (sleepMonitor) {
            sleepMonitor.notifyAll();
        }
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    public String getName() {
        return name;
    }

    public Duration getInterval() {
        return interval;
    }

    /**
     * @return passes completed without an exception, across restarts
     */
    public long getPasses() {
        return passes.get();
    }
}
