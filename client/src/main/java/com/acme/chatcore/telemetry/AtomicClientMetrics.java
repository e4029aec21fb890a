package com.acme.chatcore.telemetry;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.concurrent.atomic.LongAdder;

public final class AtomicClientMetrics implements ClientMetrics {
    private final LongAdder requests = new LongAdder();
    private final LongAdder routeRateLimited = new LongAdder();
    private final LongAdder globalRateLimited = new LongAdder();
    private final LongAdder gateWaitNanos = new LongAdder();
    private final LongAdder gateWaitSamples = new LongAdder();
    private final LongAdder identifies = new LongAdder();
    private final LongAdder resumes = new LongAdder();
    private final ConcurrentHashMap<Integer, LongAdder> responsesByStatus = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Integer, LongAdder> reconnectsByShard = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Integer, LongAdder> fatalByCloseCode = new ConcurrentHashMap<>();

    private static final int WAIT_RING_SIZE = 1024;
    private static final int WAIT_RING_MASK = WAIT_RING_SIZE - 1;
    private final AtomicLongArray waitRing = new AtomicLongArray(WAIT_RING_SIZE);
    private final AtomicLong waitRingPos = new AtomicLong();

    @Override
    public void incRequests(long n) {
        requests.add(Math.max(0L, n));
    }

    @Override
    public void incResponses(long n, int status) {
        if (n <= 0) return;
        responsesByStatus.computeIfAbsent(status, ignored -> new LongAdder()).add(n);
    }

    @Override
    public void incRateLimited(boolean global) {
        if (global) {
            globalRateLimited.increment();
        } else {
            routeRateLimited.increment();
        }
    }

    @Override
    public void observeGateWaitNanos(long nanos) {
        if (nanos < 0) return;
        gateWaitNanos.add(nanos);
        gateWaitSamples.increment();
        waitRing.set((int) (waitRingPos.getAndIncrement() & WAIT_RING_MASK), nanos);
    }

    @Override
    public void incIdentifies(int shardId) {
        identifies.increment();
    }

    @Override
    public void incResumes(int shardId) {
        resumes.increment();
    }

    @Override
    public void incReconnects(int shardId) {
        reconnectsByShard.computeIfAbsent(shardId, ignored -> new LongAdder()).increment();
    }

    @Override
    public void incFatalDisconnects(int closeCode) {
        fatalByCloseCode.computeIfAbsent(closeCode, ignored -> new LongAdder()).increment();
    }

    public long maxRecentGateWaitNanos() {
        long pos = waitRingPos.get();
        int count = (int) Math.min(pos, WAIT_RING_SIZE);
        long max = 0L;
        for (int i = 0; i < count; i++) {
            max = Math.max(max, waitRing.get(i));
        }
        return max;
    }

    public Snapshot snapshot() {
        return new Snapshot(
            requests.sum(),
            routeRateLimited.sum(),
            globalRateLimited.sum(),
            gateWaitNanos.sum(),
            gateWaitSamples.sum(),
            maxRecentGateWaitNanos(),
            identifies.sum(),
            resumes.sum(),
            mapToLongs(responsesByStatus),
            mapToLongs(reconnectsByShard),
            mapToLongs(fatalByCloseCode)
        );
    }

    private static Map<Integer, Long> mapToLongs(ConcurrentHashMap<Integer, LongAdder> src) {
        Map<Integer, Long> out = new HashMap<>();
        src.forEach((k, v) -> out.put(k, v.sum()));
        return Collections.unmodifiableMap(out);
    }

    public record Snapshot(long requests,
                           long routeRateLimited,
                           long globalRateLimited,
                           long gateWaitNanosTotal,
                           long gateWaitSamples,
                           long gateWaitMaxRecentNanos,
                           long identifies,
                           long resumes,
                           Map<Integer, Long> responsesByStatus,
                           Map<Integer, Long> reconnectsByShard,
                           Map<Integer, Long> fatalByCloseCode) {}
}
