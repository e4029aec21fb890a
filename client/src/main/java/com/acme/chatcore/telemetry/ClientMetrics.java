package com.acme.chatcore.telemetry;

/**
 * Counters fed by the dispatch coordinator and the gateway layer.
 *
 * <p>Implementations must be thread-safe; calls arrive from caller threads, Netty I/O
 * threads and shard threads.</p>
 */
public interface ClientMetrics {
    void incRequests(long n);
    void incResponses(long n, int status);
    void incRateLimited(boolean global);
    void observeGateWaitNanos(long nanos);
    void incIdentifies(int shardId);
    void incResumes(int shardId);
    void incReconnects(int shardId);
    void incFatalDisconnects(int closeCode);
}
