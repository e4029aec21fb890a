package com.acme.chatcore.gateway;

import com.acme.chatcore.http.GatewayBotInfo;
import com.acme.chatcore.http.GatewayHttpClient;
import com.acme.chatcore.http.RestException;
import com.acme.chatcore.telemetry.ClientMetrics;
import com.acme.chatcore.telemetry.NoopClientMetrics;
import com.acme.chatcore.transport.TransportFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the shards of one client and the identify throttle they share.
 *
 * <p>Shards are started one at a time: the next shard's transport is opened only after the
 * previous shard has left {@link ShardState#CONNECTING}, failed to connect or stopped.
 * Identifies within a concurrency bucket are serialized by the {@link IdentifyThrottle};
 * different buckets proceed independently. A shard that stops for good is removed and the
 * rest keep running.</p>
 */
public final class ShardManager implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(ShardManager.class.getName());

    private final ShardManagerOptions options;
    private final GatewayEventListener listener;
    private final TransportFactory transports;
    private final GatewayHttpClient http;
    private final ClientMetrics metrics;
    private final ConcurrentMap<Integer, Shard> shards = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile boolean closed;
    private volatile int shardCount;
    private volatile IdentifyThrottle throttle;

    /**
     * @param http used to discover missing shard count, concurrency or gateway URL; may be
     *             {@code null} when the options supply all three
     */
    public ShardManager(ShardManagerOptions options,
                        GatewayEventListener listener,
                        TransportFactory transports,
                        GatewayHttpClient http,
                        ClientMetrics metrics) {
        this.options = Objects.requireNonNull(options, "options");
        this.listener = listener == null ? GatewayEventListener.NOOP : listener;
        this.transports = Objects.requireNonNull(transports, "transports");
        this.http = http;
        this.metrics = metrics == null ? NoopClientMetrics.INSTANCE : metrics;
    }

    /**
     * Resolves the connection settings and starts every configured shard in index order.
     */
    public void start() throws InterruptedException, RestException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("ShardManager already started");
        }
        Integer count = options.shardCount();
        Integer concurrency = options.maxConcurrency();
        URI gateway = options.gatewayUri();
        if (count == null || concurrency == null || gateway == null) {
            if (http == null) {
                throw new IllegalStateException("shardCount, maxConcurrency and gatewayUri required without an HTTP client");
            }
            GatewayBotInfo info = http.getGatewayBot(options.token());
            LOG.info(() -> "Gateway discovered url=" + info.url() + " shards=" + info.shards()
                + " maxConcurrency=" + info.sessionStartLimit().maxConcurrency()
                + " remainingStarts=" + info.sessionStartLimit().remaining());
            count = count == null ? info.shards() : count;
            concurrency = concurrency == null ? info.sessionStartLimit().maxConcurrency() : concurrency;
            gateway = gateway == null ? URI.create(info.url()) : gateway;
        }
        this.shardCount = count;
        this.throttle = new IdentifyThrottle(concurrency, options.identifyWindow());

        List<Integer> ids = options.shardIds() == null ? allShards(count) : options.shardIds();
        int total = count;
        int maxConcurrency = concurrency;
        LOG.info(() -> "Starting shards=" + ids + " of " + total + " maxConcurrency=" + maxConcurrency);
        for (int id : ids) {
            if (closed) {
                return;
            }
            Shard shard = new Shard(id, count, gateway, options, transports, throttle,
                new ShardListener(id), metrics);
            if (shards.putIfAbsent(id, shard) != null) {
                throw new IllegalArgumentException("Duplicate shard id " + id);
            }
            shard.start();
            if (!shard.awaitStartup(options.startupTimeout())) {
                LOG.warning(() -> "Shard " + id + " did not leave CONNECTING within "
                    + options.startupTimeout().toMillis() + "ms, starting the next one");
            }
        }
    }

    private static List<Integer> allShards(int count) {
        List<Integer> ids = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            ids.add(i);
        }
        return ids;
    }

    public Shard shard(int shardId) {
        return shards.get(shardId);
    }

    public Map<Integer, Shard> shards() {
        return Collections.unmodifiableMap(shards);
    }

    public Map<Integer, ShardState> states() {
        Map<Integer, ShardState> out = new LinkedHashMap<>();
        shards.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(e -> out.put(e.getKey(), e.getValue().state()));
        return out;
    }

    /**
     * The shard responsible for a guild: {@code (guildId >> 22) % shardCount}.
     */
    public int shardForGuild(long guildId) {
        int count = shardCount;
        if (count < 1) {
            throw new IllegalStateException("ShardManager not started");
        }
        return (int) ((guildId >> 22) % count);
    }

    public int shardCount() {
        return shardCount;
    }

    public IdentifyThrottle identifyThrottle() {
        return throttle;
    }

    /**
     * Blocks until the manager is closed or no shard is left running.
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return stopped.await(timeout, unit);
    }

    @Override
    public void close() {
        closed = true;
        List<Shard> running = new ArrayList<>(shards.values());
        for (Shard shard : running) {
            try {
                shard.close();
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Failed to close shard " + shard.shardId(), e);
            }
        }
        shards.clear();
        stopped.countDown();
        LOG.info(() -> "ShardManager closed shards=" + running.size());
    }

    /**
     * Forwards to the caller's listener and drops the shard once it stops for good.
     */
    private final class ShardListener implements GatewayEventListener {
        private final int shardId;

        ShardListener(int shardId) {
            this.shardId = shardId;
        }

        @Override
        public void onDispatch(int id, GatewayPayload payload) {
            listener.onDispatch(id, payload);
        }

        @Override
        public void onConnected(int id) {
            listener.onConnected(id);
        }

        @Override
        public void onIdentified(int id, String sessionId) {
            listener.onIdentified(id, sessionId);
        }

        @Override
        public void onResumed(int id) {
            listener.onResumed(id);
        }

        @Override
        public void onDisconnected(int id, DisconnectEvent event) {
            listener.onDisconnected(id, event);
        }

        @Override
        public void onStateChanged(int id, ShardState from, ShardState to) {
            listener.onStateChanged(id, from, to);
        }

        @Override
        public void onTerminated(int id, GatewayException cause) {
            Shard removed = shards.remove(shardId);
            LOG.warning(() -> "Shard " + shardId + " removed after terminal failure: " + cause.getMessage());
            try {
                listener.onTerminated(id, cause);
            } finally {
                if (removed != null && shards.isEmpty() && !closed) {
                    stopped.countDown();
                }
            }
        }
    }
}
