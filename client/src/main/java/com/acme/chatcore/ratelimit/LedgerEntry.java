package com.acme.chatcore.ratelimit;

/**
 * Known limit parameters of one server-side bucket.
 *
 * <p>Shared by every {@link RateLimitGate} that maps onto the same bucket. After a bucket
 * merge two gates with separate locks can hold the same entry, so {@link #record} and the
 * decrement inside a grant synchronize on the entry itself. {@code unlimited} may be
 * flipped by any thread at any time and is observed on the next acquisition.</p>
 *
 * <p>{@code null} values mean "never observed".</p>
 */
public final class LedgerEntry {
    private volatile Integer limit;
    private volatile Integer remaining;
    private volatile Long resetAtNanos;
    private volatile boolean unlimited;

    public LedgerEntry() {
        this(null, false);
    }

    public LedgerEntry(Integer limit) {
        this(limit, false);
    }

    public LedgerEntry(Integer limit, boolean unlimited) {
        this.limit = limit;
        this.unlimited = unlimited;
    }

    public Integer limit() {
        return limit;
    }

    public Integer remaining() {
        return remaining;
    }

    /**
     * Absolute reset time as a {@link System#nanoTime()} value, or {@code null}.
     */
    public Long resetAtNanos() {
        return resetAtNanos;
    }

    public boolean isUnlimited() {
        return unlimited;
    }

    public void setUnlimited(boolean unlimited) {
        this.unlimited = unlimited;
    }

    synchronized void record(Integer newLimit, int newRemaining, long newResetAtNanos) {
        if (newLimit != null) {
            this.limit = newLimit;
        }
        this.remaining = newRemaining;
        this.resetAtNanos = newResetAtNanos;
    }

    synchronized void consumeOne() {
        Integer current = remaining;
        if (current != null && current > 0) {
            remaining = current - 1;
        }
    }

    @Override
    public String toString() {
        return "LedgerEntry{limit=" + limit
            + ", remaining=" + remaining
            + ", resetAtNanos=" + resetAtNanos
            + ", unlimited=" + unlimited + '}';
    }
}
