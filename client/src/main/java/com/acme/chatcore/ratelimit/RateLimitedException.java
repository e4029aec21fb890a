package com.acme.chatcore.ratelimit;

import java.time.Duration;

/**
 * Raised instead of waiting when a caller opts out of waiting on a throttled gate.
 * Carries how long the caller would have been suspended.
 */
public final class RateLimitedException extends RuntimeException {
    private final Duration retryAfter;

    public RateLimitedException(Duration retryAfter) {
        super("Rate limited, retryAfter=" + retryAfter.toMillis() + "ms");
        this.retryAfter = retryAfter;
    }

    public Duration retryAfter() {
        return retryAfter;
    }
}
