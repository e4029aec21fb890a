package com.acme.chatcore.gateway;

import java.time.Duration;
import java.util.Objects;

/**
 * The first reconnect is immediate; later ones back off from {@code base}, doubling up to
 * {@code max}. Gives up after {@code maxAttempts} consecutive attempts.
 */
public record ExponentialReconnectPolicy(int maxAttempts, Duration base, Duration max) implements ReconnectPolicy {

    public ExponentialReconnectPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(max, "max");
    }

    @Override
    public boolean allowReconnect(int shardId, int attempt) {
        return attempt <= maxAttempts;
    }

    @Override
    public Duration backoff(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        int shift = Math.min(attempt - 2, 30);
        long millis = base.toMillis() << shift;
        if (millis < 0 || millis > max.toMillis()) {
            return max;
        }
        return Duration.ofMillis(millis);
    }
}
