package com.acme.chatcore.util;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * The one "suspend until T" primitive shared by rate-limit waits, heartbeat
 * intervals and reconnect backoff.
 *
 * <p>Deadlines are {@link System#nanoTime()} values. Every wait is interruptible,
 * so cancelling any suspended operation is a matter of interrupting its thread.</p>
 */
public final class Deadlines {
    private Deadlines() {
    }

    public static long after(Duration delay) {
        return System.nanoTime() + Math.max(0L, delay.toNanos());
    }

    public static long remainingNanos(long deadlineNanos) {
        return Math.max(0L, deadlineNanos - System.nanoTime());
    }

    public static void sleepUntil(long deadlineNanos) throws InterruptedException {
        long remaining;
        while ((remaining = deadlineNanos - System.nanoTime()) > 0L) {
            TimeUnit.NANOSECONDS.sleep(remaining);
        }
        if (Thread.interrupted()) {
            throw new InterruptedException();
        }
    }

    /**
     * Sleeps until the deadline reported by {@code deadline} has passed. The supplier is
     * re-read after every wake-up, so a deadline moved while sleeping is honoured.
     */
    public static void sleepUntil(LongSupplier deadline) throws InterruptedException {
        long remaining;
        while ((remaining = deadline.getAsLong() - System.nanoTime()) > 0L) {
            TimeUnit.NANOSECONDS.sleep(remaining);
        }
        if (Thread.interrupted()) {
            throw new InterruptedException();
        }
    }

    public static void sleep(Duration delay) throws InterruptedException {
        sleepUntil(after(delay));
    }
}
