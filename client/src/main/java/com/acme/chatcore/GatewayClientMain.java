package com.acme.chatcore;

import com.acme.chatcore.gateway.DisconnectEvent;
import com.acme.chatcore.gateway.GatewayEventListener;
import com.acme.chatcore.gateway.GatewayException;
import com.acme.chatcore.gateway.GatewayPayload;
import com.acme.chatcore.gateway.ReconnectPolicy;
import com.acme.chatcore.gateway.ShardManager;
import com.acme.chatcore.gateway.ShardManagerOptions;
import com.acme.chatcore.http.GatewayHttpClient;
import com.acme.chatcore.http.NettyHttpExchange;
import com.acme.chatcore.http.RestDispatcher;
import com.acme.chatcore.telemetry.AtomicClientMetrics;
import com.acme.chatcore.telemetry.ClientMetrics;
import com.acme.chatcore.telemetry.NoopClientMetrics;
import com.acme.chatcore.telemetry.PeriodicMetricsReporter;
import com.acme.chatcore.transport.NettyWebSocketTransportFactory;
import com.acme.chatcore.util.ClientDefaults;
import com.acme.chatcore.util.ClientEnvKeys;
import com.acme.chatcore.util.EnvVars;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Logger;

/**
 * Connects every shard of a bot from environment settings and logs lifecycle events.
 */
public final class GatewayClientMain {
    private static final Logger LOG = Logger.getLogger(GatewayClientMain.class.getName());

    private GatewayClientMain() {}

    public static void main(String[] args) throws Exception {
        String token = System.getenv(ClientEnvKeys.CHATCORE_TOKEN);
        if (token == null || token.isBlank()) {
            LOG.severe(ClientEnvKeys.CHATCORE_TOKEN + " is not set");
            System.exit(2);
            return;
        }
        ShardManagerOptions options = optionsFromEnv(System.getenv(), token);

        boolean metricsEnabled = EnvVars.getBoolean(ClientEnvKeys.CHATCORE_METRICS_ENABLED, true);
        ClientMetrics metrics = metricsEnabled ? new AtomicClientMetrics() : NoopClientMetrics.INSTANCE;

        int maxInFlight = EnvVars.getIntClamped(ClientEnvKeys.CHATCORE_HTTP_MAX_INFLIGHT,
            ClientDefaults.DEFAULT_MAX_INFLIGHT, 1, 65_536);
        int responseTimeoutMs = EnvVars.getIntClamped(ClientEnvKeys.CHATCORE_HTTP_RESPONSE_TIMEOUT_MS,
            ClientDefaults.DEFAULT_RESPONSE_TIMEOUT_MS, 100, 300_000);
        String baseUrl = EnvVars.getOrDefault(ClientEnvKeys.CHATCORE_API_BASE_URL, ClientDefaults.DEFAULT_API_BASE_URL);

        RestDispatcher dispatcher = new RestDispatcher(new NettyHttpExchange(maxInFlight, responseTimeoutMs),
            baseUrl, metrics, ClientDefaults.DEFAULT_MAX_RATE_LIMIT_RETRIES);
        NettyWebSocketTransportFactory transports = new NettyWebSocketTransportFactory();
        LongAdder dispatches = new LongAdder();
        ShardManager manager = new ShardManager(options, new LoggingListener(dispatches), transports,
            new GatewayHttpClient(dispatcher), metrics);

        PeriodicMetricsReporter reporter = null;
        if (metrics instanceof AtomicClientMetrics atomicMetrics) {
            long intervalSec = EnvVars.getIntClamped(ClientEnvKeys.CHATCORE_METRICS_LOG_INTERVAL_SEC,
                (int) ClientDefaults.DEFAULT_METRICS_LOG_INTERVAL_SEC, 1, 3600);
            reporter = new PeriodicMetricsReporter(atomicMetrics, intervalSec, () -> {
                Map<String, Object> states = new LinkedHashMap<>();
                manager.states().forEach((id, state) -> states.put(String.valueOf(id), state.name()));
                states.put("dispatches", dispatches.sum());
                return states;
            });
            reporter.start();
        }

        PeriodicMetricsReporter finalReporter = reporter;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            manager.close();
            transports.close();
            dispatcher.close();
            if (finalReporter != null) {
                finalReporter.close();
            }
        }, "chatcore-shutdown"));

        manager.start();
        LOG.info(() -> "Shards started states=" + manager.states());
        while (!manager.awaitTermination(1, TimeUnit.MINUTES)) {
            LOG.fine(() -> "Shard states=" + manager.states());
        }
        LOG.warning("No shard left running, exiting");
    }

    static ShardManagerOptions optionsFromEnv(Map<String, String> env, String token) {
        int maxAttempts = EnvVars.getIntClamped(env, ClientEnvKeys.CHATCORE_RECONNECT_MAX_ATTEMPTS,
            ClientDefaults.DEFAULT_RECONNECT_MAX_ATTEMPTS, 1, 1_000);
        String intents = EnvVars.getOrDefault(env, ClientEnvKeys.CHATCORE_INTENTS, "0");
        return ShardManagerOptions.builder(token)
            .intents(parseIntents(intents))
            .shardCount(EnvVars.getOptionalInt(env, ClientEnvKeys.CHATCORE_SHARD_COUNT, 1, 1_000_000))
            .maxConcurrency(EnvVars.getOptionalInt(env, ClientEnvKeys.CHATCORE_MAX_CONCURRENCY, 1, 1_024))
            .compress(EnvVars.getBoolean(env, ClientEnvKeys.CHATCORE_GATEWAY_COMPRESS, true))
            .largeThreshold(ClientDefaults.DEFAULT_LARGE_THRESHOLD)
            .reconnectPolicy(ReconnectPolicy.exponential(maxAttempts,
                Duration.ofMillis(ClientDefaults.DEFAULT_RECONNECT_BASE_MS),
                Duration.ofMillis(ClientDefaults.DEFAULT_RECONNECT_MAX_MS)))
            .build();
    }

    static long parseIntents(String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            LOG.warning(() -> "Ignoring malformed " + ClientEnvKeys.CHATCORE_INTENTS + "=" + raw);
            return 0L;
        }
    }

    private static final class LoggingListener implements GatewayEventListener {
        private final LongAdder dispatches;

        LoggingListener(LongAdder dispatches) {
            this.dispatches = dispatches;
        }

        @Override
        public void onDispatch(int shardId, GatewayPayload payload) {
            dispatches.increment();
            LOG.finest(() -> "Shard " + shardId + " dispatch " + payload.t());
        }

        @Override
        public void onIdentified(int shardId, String sessionId) {
            LOG.info(() -> "Shard " + shardId + " identified");
        }

        @Override
        public void onResumed(int shardId) {
            LOG.info(() -> "Shard " + shardId + " resumed");
        }

        @Override
        public void onDisconnected(int shardId, DisconnectEvent event) {
            LOG.info(() -> "Shard " + shardId + " disconnected code=" + event.closeCode()
                + " action=" + event.action());
        }

        @Override
        public void onTerminated(int shardId, GatewayException cause) {
            LOG.severe(() -> "Shard " + shardId + " terminated: " + cause.getMessage());
        }
    }
}
