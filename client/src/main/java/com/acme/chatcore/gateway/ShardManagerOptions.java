package com.acme.chatcore.gateway;

import com.acme.chatcore.util.ClientDefaults;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Settings for a {@link ShardManager}. {@code shardCount}, {@code maxConcurrency} and
 * {@code gatewayUri} may be left unset, in which case they are fetched from
 * {@code GET /gateway/bot} on start.
 */
public final class ShardManagerOptions {
    private final String token;
    private final long intents;
    private final Integer shardCount;
    private final List<Integer> shardIds;
    private final Integer maxConcurrency;
    private final JsonNode presence;
    private final Integer largeThreshold;
    private final URI gatewayUri;
    private final boolean compress;
    private final Duration identifyWindow;
    private final Duration connectTimeout;
    private final Duration startupTimeout;
    private final ReconnectPolicy reconnectPolicy;

    private ShardManagerOptions(Builder b) {
        this.token = Objects.requireNonNull(b.token, "token");
        this.intents = b.intents;
        this.shardCount = b.shardCount;
        this.shardIds = b.shardIds == null ? null : List.copyOf(b.shardIds);
        this.maxConcurrency = b.maxConcurrency;
        this.presence = b.presence;
        this.largeThreshold = b.largeThreshold;
        this.gatewayUri = b.gatewayUri;
        this.compress = b.compress;
        this.identifyWindow = b.identifyWindow;
        this.connectTimeout = b.connectTimeout;
        this.startupTimeout = b.startupTimeout;
        this.reconnectPolicy = b.reconnectPolicy;
    }

    public static Builder builder(String token) {
        return new Builder(token);
    }

    public String token() {
        return token;
    }

    public long intents() {
        return intents;
    }

    public Integer shardCount() {
        return shardCount;
    }

    /**
     * Shards this manager runs, or {@code null} for all of {@code 0..shardCount-1}.
     */
    public List<Integer> shardIds() {
        return shardIds;
    }

    public Integer maxConcurrency() {
        return maxConcurrency;
    }

    public JsonNode presence() {
        return presence;
    }

    public Integer largeThreshold() {
        return largeThreshold;
    }

    public URI gatewayUri() {
        return gatewayUri;
    }

    public boolean compress() {
        return compress;
    }

    public Duration identifyWindow() {
        return identifyWindow;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public Duration startupTimeout() {
        return startupTimeout;
    }

    public ReconnectPolicy reconnectPolicy() {
        return reconnectPolicy;
    }

    public static final class Builder {
        private final String token;
        private long intents;
        private Integer shardCount;
        private List<Integer> shardIds;
        private Integer maxConcurrency;
        private JsonNode presence;
        private Integer largeThreshold;
        private URI gatewayUri;
        private boolean compress = true;
        private Duration identifyWindow = Duration.ofMillis(ClientDefaults.IDENTIFY_WINDOW_MS);
        private Duration connectTimeout = Duration.ofMillis(ClientDefaults.DEFAULT_CONNECT_TIMEOUT_MS);
        private Duration startupTimeout = Duration.ofMillis(ClientDefaults.DEFAULT_STARTUP_TIMEOUT_MS);
        private ReconnectPolicy reconnectPolicy = ReconnectPolicy.defaults();

        private Builder(String token) {
            this.token = token;
        }

        public Builder intents(long intents) {
            this.intents = intents;
            return this;
        }

        public Builder shardCount(Integer shardCount) {
            if (shardCount != null && shardCount < 1) {
                throw new IllegalArgumentException("shardCount must be >= 1");
            }
            this.shardCount = shardCount;
            return this;
        }

        public Builder shardIds(List<Integer> shardIds) {
            this.shardIds = shardIds;
            return this;
        }

        public Builder maxConcurrency(Integer maxConcurrency) {
            if (maxConcurrency != null && maxConcurrency < 1) {
                throw new IllegalArgumentException("maxConcurrency must be >= 1");
            }
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder presence(JsonNode presence) {
            this.presence = presence;
            return this;
        }

        public Builder largeThreshold(Integer largeThreshold) {
            this.largeThreshold = largeThreshold;
            return this;
        }

        public Builder gatewayUri(URI gatewayUri) {
            this.gatewayUri = gatewayUri;
            return this;
        }

        public Builder compress(boolean compress) {
            this.compress = compress;
            return this;
        }

        public Builder identifyWindow(Duration identifyWindow) {
            this.identifyWindow = Objects.requireNonNull(identifyWindow, "identifyWindow");
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
            return this;
        }

        public Builder startupTimeout(Duration startupTimeout) {
            this.startupTimeout = Objects.requireNonNull(startupTimeout, "startupTimeout");
            return this;
        }

        public Builder reconnectPolicy(ReconnectPolicy reconnectPolicy) {
            this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
            return this;
        }

        public ShardManagerOptions build() {
            return new ShardManagerOptions(this);
        }
    }
}
