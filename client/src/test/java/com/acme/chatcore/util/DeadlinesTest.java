package com.acme.chatcore.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeadlinesTest {

    @Test
    void shouldReturnImmediatelyForPastDeadline() throws Exception {
        long started = System.nanoTime();
        Deadlines.sleepUntil(System.nanoTime() - TimeUnit.SECONDS.toNanos(1));
        assertTrue(System.nanoTime() - started < TimeUnit.MILLISECONDS.toNanos(50));
        assertEquals(0L, Deadlines.remainingNanos(started));
    }

    @Test
    void shouldHonourDeadlineMovedWhileSleeping() throws Exception {
        AtomicLong deadline = new AtomicLong(Deadlines.after(Duration.ofMillis(50)));
        Thread mover = new Thread(() -> deadline.set(Deadlines.after(Duration.ofMillis(150))));
        long started = System.nanoTime();
        mover.start();
        Deadlines.sleepUntil(deadline::get);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        mover.join();
        assertTrue(elapsedMs >= 140, "sleep should follow the moved deadline, elapsedMs=" + elapsedMs);
    }

    @Test
    void shouldAbortSleepOnInterrupt() throws Exception {
        CountDownLatch sleeping = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        Thread sleeper = new Thread(() -> {
            sleeping.countDown();
            try {
                Deadlines.sleep(Duration.ofSeconds(30));
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
        });
        sleeper.start();
        assertTrue(sleeping.await(2, TimeUnit.SECONDS));
        sleeper.interrupt();
        sleeper.join(2_000);
        assertTrue(interrupted.get());
    }
}
