package com.accountdb.bancheck.check.service;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Spaces out worker starts across every batch of one task.
 */
public class SubmitThrottle {
    private final long delayNanos;
    private long nextAllowedNanos;

    public SubmitThrottle(Duration delay) {
        this.delayNanos = delay == null || delay.isNegative() ? 0L : delay.toNanos();
    }

    public synchronized void awaitTurn() throws InterruptedException {
        if (delayNanos <= 0) {
            return;
        }
        long now = System.nanoTime();
        long waitNanos = nextAllowedNanos - now;
        if (nextAllowedNanos != 0 && waitNanos > 0) {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
            now = System.nanoTime();
        }
        nextAllowedNanos = now + delayNanos;
    }
}
