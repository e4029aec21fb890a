package com.acme.chatcore.util;

/**
 * Canonical environment variable names used by the client runtime.
 */
public final class ClientEnvKeys {
    public static final String CHATCORE_TOKEN = "CHATCORE_TOKEN";
    public static final String CHATCORE_API_BASE_URL = "CHATCORE_API_BASE_URL";

    public static final String CHATCORE_INTENTS = "CHATCORE_INTENTS";
    public static final String CHATCORE_SHARD_COUNT = "CHATCORE_SHARD_COUNT";
    public static final String CHATCORE_MAX_CONCURRENCY = "CHATCORE_MAX_CONCURRENCY";
    public static final String CHATCORE_GATEWAY_COMPRESS = "CHATCORE_GATEWAY_COMPRESS";
    public static final String CHATCORE_RECONNECT_MAX_ATTEMPTS = "CHATCORE_RECONNECT_MAX_ATTEMPTS";

    public static final String CHATCORE_HTTP_MAX_INFLIGHT = "CHATCORE_HTTP_MAX_INFLIGHT";
    public static final String CHATCORE_HTTP_RESPONSE_TIMEOUT_MS = "CHATCORE_HTTP_RESPONSE_TIMEOUT_MS";

    public static final String CHATCORE_METRICS_ENABLED = "CHATCORE_METRICS_ENABLED";
    public static final String CHATCORE_METRICS_LOG_INTERVAL_SEC = "CHATCORE_METRICS_LOG_INTERVAL_SEC";

    private ClientEnvKeys() {
    }
}
