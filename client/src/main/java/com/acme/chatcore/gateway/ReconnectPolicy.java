package com.acme.chatcore.gateway;

import com.acme.chatcore.util.ClientDefaults;

import java.time.Duration;

/**
 * Decides whether a shard may reconnect and how long it waits first.
 *
 * <p>{@code attempt} counts consecutive reconnects since the shard was last ready,
 * starting at 1.</p>
 */
public interface ReconnectPolicy {

    boolean allowReconnect(int shardId, int attempt);

    Duration backoff(int attempt);

    static ReconnectPolicy exponential(int maxAttempts, Duration base, Duration max) {
        return new ExponentialReconnectPolicy(maxAttempts, base, max);
    }

    static ReconnectPolicy defaults() {
        return exponential(
            ClientDefaults.DEFAULT_RECONNECT_MAX_ATTEMPTS,
            Duration.ofMillis(ClientDefaults.DEFAULT_RECONNECT_BASE_MS),
            Duration.ofMillis(ClientDefaults.DEFAULT_RECONNECT_MAX_MS)
        );
    }
}
