package com.acme.chatcore.http;

import java.time.Duration;

/**
 * Result of {@code GET /gateway/bot}: where to connect, the recommended shard count and
 * the identify budget.
 */
public record GatewayBotInfo(String url, int shards, SessionStartLimit sessionStartLimit) {

    public record SessionStartLimit(int total, int remaining, Duration resetAfter, int maxConcurrency) {
    }
}
