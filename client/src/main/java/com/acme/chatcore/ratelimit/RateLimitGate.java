package com.acme.chatcore.ratelimit;

import com.acme.chatcore.util.Deadlines;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes and throttles acquisitions against one {@link LedgerEntry}.
 *
 * <p>The gate replays the server's stated policy and nothing more: {@code remaining}
 * changes only through {@link #update} or the single decrement of a grant taken while it
 * was positive, and {@code resetAt} only through {@link #update}. A caller that waited for
 * the reset does not refill anything; the next {@code update} does.</p>
 *
 * <p>Acquisition order is FIFO (fair lock). The lock is held for the whole permit scope,
 * so guarded sections never overlap; {@link #update} re-enters it from the holder.</p>
 */
public final class RateLimitGate {
    private final ReentrantLock lock = new ReentrantLock(true);
    private volatile LedgerEntry entry;
    private volatile boolean dirty;

    public RateLimitGate(LedgerEntry entry) {
        this.entry = Objects.requireNonNull(entry, "entry");
    }

    /**
     * Acquires a permit, waiting for the bucket to reset when it is exhausted.
     */
    public Permit acquire() throws InterruptedException {
        return acquire(true);
    }

    /**
     * Acquires a permit.
     *
     * @param wait when {@code false}, an exhausted bucket raises {@link RateLimitedException}
     *             instead of suspending
     * @throws InterruptedException if the thread is interrupted while queued or waiting
     */
    public Permit acquire(boolean wait) throws InterruptedException {
        lock.lockInterruptibly();
        boolean granted = false;
        try {
            LedgerEntry current = entry;
            if (!current.isUnlimited()) {
                reserve(current, wait);
            }
            granted = true;
            return new GatePermit();
        } finally {
            if (!granted) {
                lock.unlock();
            }
        }
    }

    private void reserve(LedgerEntry current, boolean wait) throws InterruptedException {
        Integer remaining = current.remaining();
        if (current.limit() == null || remaining == null) {
            // Nothing observed yet: optimistic grant, nothing to decrement.
            if (current.limit() != null) {
                dirty = true;
            }
            return;
        }
        if (remaining > 0) {
            current.consumeOne();
            dirty = true;
            return;
        }
        Long resetAt = current.resetAtNanos();
        if (resetAt != null && resetAt - System.nanoTime() > 0L) {
            if (!wait) {
                throw new RateLimitedException(Duration.ofNanos(Deadlines.remainingNanos(resetAt)));
            }
            Deadlines.sleepUntil(() -> {
                Long latest = entry.resetAtNanos();
                return latest == null ? 0L : latest;
            });
        }
        dirty = true;
    }

    /**
     * Records the server's authoritative view after an exchange.
     */
    public void update(int remaining, Duration resetAfter) {
        update(null, remaining, resetAfter);
    }

    public void update(Integer limit, int remaining, Duration resetAfter) {
        Objects.requireNonNull(resetAfter, "resetAfter");
        long resetAt = System.nanoTime() + Math.max(0L, resetAfter.toNanos());
        lock.lock();
        try {
            entry.record(limit, remaining, resetAt);
            dirty = true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Points this gate at another ledger entry. Used when bucket discovery finds that two
     * route-classes share one server bucket; the entry is shared, not copied.
     */
    public void rebind(LedgerEntry shared) {
        Objects.requireNonNull(shared, "shared");
        lock.lock();
        try {
            this.entry = shared;
        } finally {
            lock.unlock();
        }
    }

    public LedgerEntry entry() {
        return entry;
    }

    /**
     * Whether this gate ever reserved a permit under a known limit or recorded an update.
     * Never reverts.
     */
    public boolean isDirty() {
        return dirty;
    }

    public boolean hasQueuedAcquirers() {
        return lock.hasQueuedThreads();
    }

    /**
     * Estimated number of callers waiting for the lock, for monitoring.
     */
    public int queueLength() {
        return lock.getQueueLength();
    }

    private final class GatePermit implements Permit {
        private boolean closed;

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                lock.unlock();
            }
        }
    }

    @Override
    public String toString() {
        return "RateLimitGate{" + entry + ", dirty=" + dirty + '}';
    }
}
