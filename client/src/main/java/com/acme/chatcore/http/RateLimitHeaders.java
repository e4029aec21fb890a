package com.acme.chatcore.http;

import java.time.Duration;

/**
 * Rate-limit state reported by the server on a response.
 */
public record RateLimitHeaders(Integer limit,
                               Integer remaining,
                               Duration resetAfter,
                               String bucket,
                               boolean global,
                               String scope) {

    public static final String LIMIT = "x-ratelimit-limit";
    public static final String REMAINING = "x-ratelimit-remaining";
    public static final String RESET_AFTER = "x-ratelimit-reset-after";
    public static final String BUCKET = "x-ratelimit-bucket";
    public static final String GLOBAL = "x-ratelimit-global";
    public static final String SCOPE = "x-ratelimit-scope";
    public static final String RETRY_AFTER = "retry-after";

    public static RateLimitHeaders parse(RestResponse response) {
        return new RateLimitHeaders(
            parseInt(response.header(LIMIT)),
            parseInt(response.header(REMAINING)),
            parseSeconds(response.header(RESET_AFTER)),
            blankToNull(response.header(BUCKET)),
            Boolean.parseBoolean(response.header(GLOBAL)),
            blankToNull(response.header(SCOPE))
        );
    }

    /**
     * Whether the response carried enough to update a gate.
     */
    public boolean present() {
        return remaining != null && resetAfter != null;
    }

    public boolean any() {
        return limit != null || remaining != null || resetAfter != null || bucket != null;
    }

    static Integer parseInt(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ignored) {
            return null;
        }
    }

    static Duration parseSeconds(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            double seconds = Double.parseDouble(raw.trim());
            if (Double.isNaN(seconds) || seconds < 0.0d) {
                return null;
            }
            return Duration.ofNanos((long) (seconds * 1_000_000_000L));
        } catch (NumberFormatException ignored) {
            return null;
        }
    }

    private static String blankToNull(String raw) {
        return raw == null || raw.isBlank() ? null : raw.trim();
    }
}
