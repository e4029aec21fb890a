package com.acme.chatcore.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RateLimitGateTest {
    private static final Duration WINDOW = Duration.ofMillis(100);
    private static final long TOLERANCE_MS = 100;

    @Test
    void shouldSpaceConsecutiveAcquisitionsByResetWindow() throws Exception {
        RateLimitGate gate = new RateLimitGate(new LedgerEntry(1));
        gate.update(1, WINDOW);

        long started = System.nanoTime();
        for (int i = 0; i < 3; i++) {
            try (Permit ignored = gate.acquire()) {
                gate.update(0, WINDOW);
            }
        }
        assertElapsedAbout(started, 200);
    }

    @Test
    void shouldSpaceConcurrentCallersAndNeverOverlap() throws Exception {
        RateLimitGate gate = new RateLimitGate(new LedgerEntry(1));
        gate.update(1, WINDOW);
        AtomicInteger inside = new AtomicInteger();
        AtomicBoolean overlapped = new AtomicBoolean();
        CountDownLatch ready = new CountDownLatch(3);
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                futures.add(pool.submit(() -> {
                    ready.countDown();
                    go.await();
                    try (Permit ignored = gate.acquire()) {
                        if (inside.incrementAndGet() > 1) {
                            overlapped.set(true);
                        }
                        gate.update(0, WINDOW);
                        inside.decrementAndGet();
                    }
                    return null;
                }));
            }
            assertTrue(ready.await(2, TimeUnit.SECONDS));
            long started = System.nanoTime();
            go.countDown();
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
            assertElapsedAbout(started, 200);
            assertFalse(overlapped.get(), "guarded sections must not overlap");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldNeverWaitWithoutLimitInformation() throws Exception {
        RateLimitGate gate = new RateLimitGate(new LedgerEntry());
        long started = System.nanoTime();
        for (int i = 0; i < 5; i++) {
            try (Permit ignored = gate.acquire()) {
                assertNull(gate.entry().remaining());
            }
        }
        assertElapsedAbout(started, 0);
        assertFalse(gate.isDirty());
    }

    @Test
    void shouldNotInventGrantsAfterInitialInformation() throws Exception {
        RateLimitGate gate = new RateLimitGate(new LedgerEntry(1));
        gate.update(1, WINDOW);
        long started = System.nanoTime();
        for (int i = 0; i < 3; i++) {
            try (Permit ignored = gate.acquire()) {
                assertEquals(0, gate.entry().remaining());
            }
        }
        // only the second acquisition waits: the third sees the same, already passed, reset
        assertElapsedAbout(started, 100);
    }

    @Test
    void shouldIgnoreLimitsWhenUnlimited() throws Exception {
        LedgerEntry entry = new LedgerEntry(1);
        RateLimitGate gate = new RateLimitGate(entry);
        gate.update(1, Duration.ofSeconds(1));
        entry.setUnlimited(true);

        long started = System.nanoTime();
        for (int i = 0; i < 3; i++) {
            try (Permit ignored = gate.acquire()) {
                gate.update(0, Duration.ofSeconds(1));
            }
        }
        assertElapsedAbout(started, 0);
    }

    @Test
    void shouldThrowInsteadOfWaitingWhenAskedNotToWait() throws Exception {
        RateLimitGate gate = new RateLimitGate(new LedgerEntry(1));
        gate.update(0, Duration.ofSeconds(5));

        RateLimitedException error = assertThrows(RateLimitedException.class, () -> gate.acquire(false));
        assertTrue(error.retryAfter().toMillis() > 4_000, "retryAfter=" + error.retryAfter());
        assertFalse(gate.hasQueuedAcquirers());

        // the failed attempt must not keep the gate locked
        gate.entry().setUnlimited(true);
        try (Permit ignored = gate.acquire(false)) {
            assertTrue(gate.entry().isUnlimited());
        }
    }

    @Test
    void shouldChangeRemainingOnlyThroughUpdateOrGrant() throws Exception {
        RateLimitGate gate = new RateLimitGate(new LedgerEntry(5));
        gate.update(3, Duration.ofSeconds(10));
        assertEquals(3, gate.entry().remaining());
        try (Permit ignored = gate.acquire()) {
            assertEquals(2, gate.entry().remaining());
        }
        assertEquals(2, gate.entry().remaining(), "releasing a permit must not touch remaining");
        gate.update(4, 7, Duration.ofSeconds(10));
        assertEquals(4, gate.entry().limit());
        assertEquals(7, gate.entry().remaining());
    }

    @Test
    void shouldGrantInArrivalOrder() throws Exception {
        RateLimitGate gate = new RateLimitGate(new LedgerEntry(1));
        gate.update(0, Duration.ofMillis(300));
        List<Integer> order = new ArrayList<>();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                int id = i;
                futures.add(pool.submit(() -> {
                    try (Permit ignored = gate.acquire()) {
                        synchronized (order) {
                            order.add(id);
                        }
                    }
                    return null;
                }));
                if (i == 0) {
                    Thread.sleep(50);
                    continue;
                }
                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
                while (gate.queueLength() < i && System.nanoTime() < deadline) {
                    Thread.onSpinWait();
                }
            }
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
            assertEquals(List.of(0, 1, 2, 3), order);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldInterruptWaitingAcquirerAndReleaseLock() throws Exception {
        RateLimitGate gate = new RateLimitGate(new LedgerEntry(1));
        gate.update(0, Duration.ofSeconds(30));
        AtomicBoolean interrupted = new AtomicBoolean();
        Thread waiter = new Thread(() -> {
            try (Permit ignored = gate.acquire()) {
                interrupted.set(false);
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
        });
        waiter.start();
        Thread.sleep(100);
        waiter.interrupt();
        waiter.join(2_000);
        assertTrue(interrupted.get());

        gate.update(1, Duration.ofSeconds(30));
        try (Permit ignored = gate.acquire(false)) {
            assertEquals(0, gate.entry().remaining());
        }
    }

    @Test
    void shouldToleratePermitClosedTwice() throws Exception {
        RateLimitGate gate = new RateLimitGate(new LedgerEntry());
        Permit permit = gate.acquire();
        permit.close();
        permit.close();
        try (Permit ignored = gate.acquire(false)) {
            assertFalse(gate.hasQueuedAcquirers());
        }
    }

    @Test
    void shouldStartClean() {
        RateLimitGate gate = new RateLimitGate(new LedgerEntry());
        assertFalse(gate.isDirty());
    }

    @Test
    void shouldBeDirtyInsideReservationUnderKnownLimit() throws Exception {
        RateLimitGate gate = new RateLimitGate(new LedgerEntry(1));
        try (Permit ignored = gate.acquire()) {
            assertTrue(gate.isDirty());
        }
    }

    @Test
    void shouldStayDirtyAfterReportedUsage() throws Exception {
        RateLimitGate gate = new RateLimitGate(new LedgerEntry(1));
        try (Permit ignored = gate.acquire()) {
            gate.update(0, Duration.ofSeconds(1));
        }
        assertTrue(gate.isDirty());
    }

    @Test
    void shouldShareEntryAfterRebind() throws Exception {
        LedgerEntry shared = new LedgerEntry(2);
        RateLimitGate owner = new RateLimitGate(shared);
        RateLimitGate merged = new RateLimitGate(new LedgerEntry());
        merged.rebind(shared);
        owner.update(1, Duration.ofSeconds(10));
        try (Permit ignored = merged.acquire(false)) {
            assertEquals(0, shared.remaining());
        }
        assertThrows(RateLimitedException.class, () -> owner.acquire(false));
    }

    @Test
    void shouldCountEveryGrantAcrossGatesSharingOneEntry() throws Exception {
        LedgerEntry shared = new LedgerEntry(10_000);
        RateLimitGate owner = new RateLimitGate(shared);
        RateLimitGate merged = new RateLimitGate(new LedgerEntry());
        merged.rebind(shared);
        owner.update(10_000, Duration.ofSeconds(30));
        int perThread = 2_000;
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (RateLimitGate gate : List.of(owner, merged, owner, merged)) {
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < perThread; i++) {
                        gate.acquire(false).close();
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(10_000 - 4 * perThread, shared.remaining());
    }

    private static void assertElapsedAbout(long startedNanos, long expectedMs) {
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        assertTrue(elapsedMs >= expectedMs - 15 && elapsedMs <= expectedMs + TOLERANCE_MS,
            "expected ~" + expectedMs + "ms, took " + elapsedMs + "ms");
    }
}
