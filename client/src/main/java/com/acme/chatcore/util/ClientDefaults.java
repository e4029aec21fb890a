package com.acme.chatcore.util;

/**
 * Default endpoints, timeouts, and protocol constants for the client runtime.
 * <p>
 * These values are used when the corresponding environment variable or option is not set.
 */
public final class ClientDefaults {

    // ---- Endpoints ----
    public static final String DEFAULT_API_BASE_URL = "https://discord.com/api/v10";
    public static final int GATEWAY_API_VERSION = 10;
    public static final String GATEWAY_ENCODING = "json";
    public static final String USER_AGENT = "chatcore-client/0.1";
    public static final int HTTPS_DEFAULT_PORT = 443;
    public static final int HTTP_DEFAULT_PORT = 80;

    // ---- HTTP exchange ----
    public static final int DEFAULT_MAX_INFLIGHT = 1_024;
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 5_000;
    public static final int DEFAULT_RESPONSE_TIMEOUT_MS = 15_000;
    public static final int DEFAULT_HTTP_IO_THREADS = 2;
    public static final int HTTP_RESPONSE_LIMIT = 8 * 1024 * 1024;
    public static final int DEFAULT_MAX_RATE_LIMIT_RETRIES = 5;

    // ---- Gateway ----
    public static final int MAX_FRAME_PAYLOAD = 16 * 1024 * 1024;
    public static final long IDENTIFY_WINDOW_MS = 5_000L;
    public static final long DEFAULT_STARTUP_TIMEOUT_MS = 30_000L;
    public static final long INVALID_SESSION_MIN_DELAY_MS = 1_000L;
    public static final long INVALID_SESSION_MAX_DELAY_MS = 5_000L;
    public static final long SHARD_JOIN_TIMEOUT_MS = 2_000L;
    public static final int DEFAULT_LARGE_THRESHOLD = 50;

    // ---- Reconnect ----
    public static final int DEFAULT_RECONNECT_MAX_ATTEMPTS = 10;
    public static final long DEFAULT_RECONNECT_BASE_MS = 1_000L;
    public static final long DEFAULT_RECONNECT_MAX_MS = 60_000L;

    // ---- Metrics ----
    public static final long DEFAULT_METRICS_LOG_INTERVAL_SEC = 60L;

    private ClientDefaults() {
    }
}
