/* (C)2026 */
package com.ammann.updatetracker.service;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Interrupts the thread that opened it once the given time has passed, so that a blocking
 * registry check gives up instead of running on after its result is no longer wanted.
 *
 * <p>Closing the deadline cancels it and clears an interrupt it raised, leaving the worker
 * thread clean for the next task.
 */
final class CheckDeadline implements AutoCloseable {

    private static final ScheduledExecutorService TIMER =
            Executors.newSingleThreadScheduledExecutor(
                    task -> {
                        Thread thread = new Thread(task, "registry-check-deadline");
                        thread.setDaemon(true);
                        return thread;
                    });

    private final Thread worker;
    private final ScheduledFuture<?> timer;
    private boolean expired;
    private boolean done;

    private CheckDeadline(Duration timeout) {
        this.worker = Thread.currentThread();
        this.timer = TIMER.schedule(this::expire, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Starts a deadline for the calling thread. */
    static CheckDeadline start(Duration timeout) {
        return new CheckDeadline(timeout);
    }

    synchronized boolean isExpired() {
        return expired;
    }

    private synchronized void expire() {
        if (!done) {
            expired = true;
            worker.interrupt();
        }
    }

    @Override
    public void close() {
        timer.cancel(false);
        synchronized (this) {
            done = true;
            if (expired) {
                Thread.interrupted();
            }
        }
    }
}
