package com.acme.chatcore.telemetry;

import com.acme.chatcore.util.JsonCodec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs a JSON metrics snapshot at a fixed interval.
 */
public final class PeriodicMetricsReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeriodicMetricsReporter.class.getName());

    private final AtomicClientMetrics metrics;
    private final Supplier<Map<String, Object>> shardStatesSupplier;
    private final ScheduledExecutorService executor;
    private final long intervalSeconds;

    public PeriodicMetricsReporter(AtomicClientMetrics metrics, long intervalSeconds) {
        this(metrics, intervalSeconds, Map::of);
    }

    public PeriodicMetricsReporter(AtomicClientMetrics metrics,
                                   long intervalSeconds,
                                   Supplier<Map<String, Object>> shardStatesSupplier) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.shardStatesSupplier = shardStatesSupplier == null ? Map::of : shardStatesSupplier;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "chatcore-metrics-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    String render() {
        AtomicClientMetrics.Snapshot s = metrics.snapshot();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("component", "chatcore");
        payload.put("type", "client_metrics");
        payload.put("requests", s.requests());
        payload.put("responsesByStatus", s.responsesByStatus());
        payload.put("routeRateLimited", s.routeRateLimited());
        payload.put("globalRateLimited", s.globalRateLimited());
        payload.put("gateWaitNanosTotal", s.gateWaitNanosTotal());
        payload.put("gateWaitSamples", s.gateWaitSamples());
        payload.put("gateWaitMaxRecentNanos", s.gateWaitMaxRecentNanos());
        payload.put("identifies", s.identifies());
        payload.put("resumes", s.resumes());
        payload.put("reconnectsByShard", s.reconnectsByShard());
        payload.put("fatalByCloseCode", s.fatalByCloseCode());
        Map<String, Object> shards = shardStatesSupplier.get();
        if (shards != null && !shards.isEmpty()) {
            payload.put("shards", shards);
        }
        try {
            return JsonCodec.writeString(payload);
        } catch (Exception e) {
            return payload.toString();
        }
    }

    private void emit() {
        try {
            LOG.info(render());
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Metrics reporter failure", e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
