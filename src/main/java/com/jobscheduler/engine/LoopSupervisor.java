package com.jobscheduler.engine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs each {@link BackgroundLoop} on its own thread and restarts a loop that
 * exits while the supervisor is still active, so one crashed loop never takes
 * the worker down with it.
 */
public class LoopSupervisor {
    private static final Logger logger = Logger.getLogger(LoopSupervisor.class.getName());

    private final List<BackgroundLoop> loops;
    private final Duration restartDelay;
    private final AtomicBoolean active = new AtomicBoolean(false);
    private final List<Thread> threads = new ArrayList<>();
    private final Map<String, AtomicInteger> restarts = new ConcurrentHashMap<>();

    public LoopSupervisor(List<BackgroundLoop> loops, Duration restartDelay) {
        this.loops = List.copyOf(loops);
        this.restartDelay = restartDelay;
        for (BackgroundLoop loop : this.loops) {
            restarts.put(loop.getName(), new AtomicInteger());
        }
    }

    /**
     * Start one supervised thread per loop. Calling it again is a no-op.
     */
    public synchronized void start() {
        if (!active.compareAndSet(false, true)) {
            logger.warning("Loop supervisor is already running");
            return;
        }

        for (BackgroundLoop loop : loops) {
            Thread thread = new Thread(() -> supervise(loop), "scheduler-" + loop.getName());
            thread.setDaemon(false);
            threads.add(thread);
            thread.start();
        }
        logger.info("Supervising " + loops.size() + " loops");
    }

    private void supervise(BackgroundLoop loop) {
        while (active.get()) {
            try {
                loop.run();
            } catch (RuntimeException | Error e) {
                logger.log(Level.SEVERE, "Loop " + loop.getName() + " crashed", e);
            }

            if (!active.get() || loop.isStopRequested() || Thread.currentThread().isInterrupted()) {
                break;
            }

            int count = restarts.get(loop.getName()).incrementAndGet();
            logger.warning("Loop " + loop.getName() + " exited unexpectedly, restart #" + count
                    + " in " + restartDelay);
            try {
                Thread.sleep(restartDelay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    /**
     * Stop every loop and wait for its thread, interrupting threads that do
     * not finish within the timeout.
     *
     * @return true if every loop thread ended in time
     */
    public synchronized boolean stop(Duration timeout) {
        if (!active.compareAndSet(true, false)) {
            return true;
        }
        loops.forEach(BackgroundLoop::stop);

        long deadline = System.nanoTime() + timeout.toNanos();
        boolean clean = true;
        for (Thread thread : threads) {
            long remainingMs = Math.max(0L, (deadline - System.nanoTime()) / 1_000_000L);
            try {
                thread.join(Math.max(1L, remainingMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                logger.warning("Thread " + thread.getName() + " did not stop within " + timeout + ", interrupting");
                thread.interrupt();
                clean = false;
            }
        }
        threads.clear();
        logger.info("Loop supervisor stopped");
        return clean;
    }

    public boolean isActive() {
        return active.get();
    }

    public int getRestartCount(String loopName) {
        AtomicInteger count = restarts.get(loopName);
        return count == null ? 0 : count.get();
    }

    public List<BackgroundLoop> getLoops() {
        return loops;
    }
}
