package com.accountdb.bancheck.check.service;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Pause shared by the workers of one batch after the remote side answered 429.
 */
public class RateLimitGate {
    private long pausedUntilNanos;
    private boolean paused;
    private long pauseCount;

    public synchronized void pauseFor(Duration pause) {
        if (pause == null || pause.isNegative() || pause.isZero()) {
            return;
        }
        long until = System.nanoTime() + pause.toNanos();
        if (!paused || until - pausedUntilNanos > 0) {
            pausedUntilNanos = until;
        }
        paused = true;
        pauseCount++;
    }

    public void awaitOpen() throws InterruptedException {
        while (true) {
            long waitNanos;
            synchronized (this) {
                if (!paused) {
                    return;
                }
                waitNanos = pausedUntilNanos - System.nanoTime();
                if (waitNanos <= 0) {
                    paused = false;
                    return;
                }
            }
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
    }

    public synchronized long pauseCount() {
        return pauseCount;
    }
}
