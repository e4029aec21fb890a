package com.acme.chatcore.gateway;

import com.acme.chatcore.ratelimit.LedgerEntry;
import com.acme.chatcore.ratelimit.Permit;
import com.acme.chatcore.ratelimit.RateLimitGate;

import java.time.Duration;
import java.util.Objects;

/**
 * The identify concurrency ceiling: one gate per bucket {@code shardId % maxConcurrency},
 * each allowing one identify per window.
 *
 * <p>The limit is known up front, so every grant immediately records an exhausted window;
 * the next acquirer in the bucket waits for it to pass. Grants within a bucket are FIFO.</p>
 */
public final class IdentifyThrottle {
    private final int maxConcurrency;
    private final Duration window;
    private final RateLimitGate[] buckets;

    public IdentifyThrottle(int maxConcurrency, Duration window) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1");
        }
        this.maxConcurrency = maxConcurrency;
        this.window = Objects.requireNonNull(window, "window");
        this.buckets = new RateLimitGate[maxConcurrency];
        for (int i = 0; i < maxConcurrency; i++) {
            buckets[i] = new RateLimitGate(new LedgerEntry(1));
        }
    }

    public int bucketOf(int shardId) {
        return Math.floorMod(shardId, maxConcurrency);
    }

    /**
     * Waits for the shard's bucket. Hold the permit while sending the identify.
     */
    public Permit acquire(int shardId) throws InterruptedException {
        RateLimitGate gate = buckets[bucketOf(shardId)];
        Permit permit = gate.acquire();
        gate.update(1, 0, window);
        return permit;
    }

    /**
     * Shards currently waiting on the bucket of {@code shardId}.
     */
    public int queueLength(int shardId) {
        return buckets[bucketOf(shardId)].queueLength();
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    public Duration window() {
        return window;
    }
}
