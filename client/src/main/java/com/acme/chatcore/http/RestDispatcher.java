package com.acme.chatcore.http;

import com.acme.chatcore.ratelimit.LedgerEntry;
import com.acme.chatcore.ratelimit.Permit;
import com.acme.chatcore.ratelimit.RateLimitGate;
import com.acme.chatcore.telemetry.ClientMetrics;
import com.acme.chatcore.telemetry.NoopClientMetrics;
import com.acme.chatcore.util.ClientDefaults;
import com.acme.chatcore.util.HttpStatusCodes;
import com.acme.chatcore.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends REST requests through the global gate and the route's gate, and feeds the
 * server-reported limits back into both.
 *
 * <p>Per request: the global gate of the caller's rate-limit key is passed (acquired and
 * released straight away), then the route gate is held for the whole exchange and updated
 * from the response before it is released. A 429 updates either the global or the route
 * gate and the request is retried up to a fixed budget.</p>
 */
public final class RestDispatcher implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(RestDispatcher.class.getName());
    private static final String UNAUTHENTICATED = "";
    private static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(1);

    private final HttpExchange exchange;
    private final String baseUrl;
    private final ClientMetrics metrics;
    private final int maxRateLimitRetries;
    private final ConcurrentHashMap<String, RateLimitGate> globalGates = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, BucketRegistry> registries = new ConcurrentHashMap<>();

    public RestDispatcher(HttpExchange exchange) {
        this(exchange, ClientDefaults.DEFAULT_API_BASE_URL, NoopClientMetrics.INSTANCE,
            ClientDefaults.DEFAULT_MAX_RATE_LIMIT_RETRIES);
    }

    public RestDispatcher(HttpExchange exchange, String baseUrl, ClientMetrics metrics, int maxRateLimitRetries) {
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.metrics = metrics == null ? NoopClientMetrics.INSTANCE : metrics;
        this.maxRateLimitRetries = Math.max(0, maxRateLimitRetries);
    }

    public RestResponse request(Route route, String rateLimitKey) throws InterruptedException, RestException {
        return request(route, rateLimitKey, Map.of(), null, true);
    }

    /**
     * Performs one logical request, retrying on 429 responses.
     *
     * @param rateLimitKey the authentication the request is charged to, or {@code null}
     *                     for unauthenticated requests
     * @param wait         when {@code false}, a throttled gate raises
     *                     {@link com.acme.chatcore.ratelimit.RateLimitedException} instead
     *                     of suspending
     * @throws RestException on a non-success status, a transport failure, or when the
     *                       rate-limit retry budget is spent
     */
    public RestResponse request(Route route,
                                String rateLimitKey,
                                Map<String, String> headers,
                                byte[] body,
                                boolean wait) throws InterruptedException, RestException {
        Objects.requireNonNull(route, "route");
        String key = rateLimitKey == null ? UNAUTHENTICATED : rateLimitKey;
        RestRequest request = new RestRequest(route.method(), URI.create(baseUrl + route.path()), headers, body);

        for (int attempt = 0; ; attempt++) {
            if (!route.ignoreGlobal()) {
                passGlobal(key, wait);
            }
            RestResponse response = exchangeUnderRouteGate(route, key, request, wait);
            if (response.status() != HttpStatusCodes.TOO_MANY_REQUESTS) {
                if (!HttpStatusCodes.isSuccess(response.status())) {
                    throw new RestException(response.status(), response.body(),
                        route.routeClass() + " failed with status " + response.status());
                }
                return response;
            }
            if (attempt >= maxRateLimitRetries) {
                throw new RestException(response.status(), response.body(),
                    route.routeClass() + " still rate limited after " + (attempt + 1) + " attempts");
            }
        }
    }

    public RateLimitGate globalGate(String rateLimitKey) {
        return globalGates.computeIfAbsent(rateLimitKey == null ? UNAUTHENTICATED : rateLimitKey,
            ignored -> new RateLimitGate(new LedgerEntry()));
    }

    public RateLimitGate routeGate(Route route, String rateLimitKey) {
        return registry(rateLimitKey == null ? UNAUTHENTICATED : rateLimitKey).gateFor(route);
    }

    private void passGlobal(String key, boolean wait) throws InterruptedException {
        long started = System.nanoTime();
        try (Permit ignored = globalGate(key).acquire(wait)) {
            metrics.observeGateWaitNanos(System.nanoTime() - started);
        }
    }

    private RestResponse exchangeUnderRouteGate(Route route,
                                                String key,
                                                RestRequest request,
                                                boolean wait) throws InterruptedException, RestException {
        BucketRegistry registry = registry(key);
        RateLimitGate gate = registry.gateFor(route);
        long started = System.nanoTime();
        try (Permit ignored = gate.acquire(wait)) {
            metrics.observeGateWaitNanos(System.nanoTime() - started);
            metrics.incRequests(1);
            RestResponse response = await(exchange.execute(request), route);
            metrics.incResponses(1, response.status());
            applyLimits(route, key, registry, gate, response);
            return response;
        }
    }

    private void applyLimits(Route route,
                             String key,
                             BucketRegistry registry,
                             RateLimitGate gate,
                             RestResponse response) {
        RateLimitHeaders limits = RateLimitHeaders.parse(response);
        RateLimitGate target = gate;
        if (limits.bucket() != null) {
            target = registry.bindBucket(route, gate, limits.bucket());
        }

        if (response.status() == HttpStatusCodes.TOO_MANY_REQUESTS) {
            RateLimitBody body = RateLimitBody.parse(response);
            Duration retryAfter = firstNonNull(body.retryAfter(),
                RateLimitHeaders.parseSeconds(response.header(RateLimitHeaders.RETRY_AFTER)),
                limits.resetAfter(),
                DEFAULT_RETRY_AFTER);
            boolean global = body.global() || limits.global();
            metrics.incRateLimited(global);
            if (!global) {
                clearUnlimited(route, target);
            }
            if (global) {
                LOG.warning(() -> "Global rate limit hit route=" + route.routeClass()
                    + " retryAfterMs=" + retryAfter.toMillis());
                RateLimitGate shared = globalGate(key);
                shared.update(knownLimit(shared, null), 0, retryAfter);
            } else {
                LOG.warning(() -> "Route rate limit hit route=" + route.bucketKey()
                    + " scope=" + limits.scope() + " retryAfterMs=" + retryAfter.toMillis());
                target.update(knownLimit(target, limits.limit()), 0, retryAfter);
            }
            return;
        }

        if (limits.present()) {
            clearUnlimited(route, target);
            target.update(knownLimit(target, limits.limit()), limits.remaining(), limits.resetAfter());
        } else if (!limits.any() && HttpStatusCodes.isSuccess(response.status())) {
            if (!target.entry().isUnlimited()) {
                LOG.fine(() -> "No rate limit reported, marking unlimited route=" + route.bucketKey());
                target.entry().setUnlimited(true);
            }
        }
    }

    private static void clearUnlimited(Route route, RateLimitGate target) {
        if (target.entry().isUnlimited()) {
            LOG.fine(() -> "Rate limit reported again, tracking route=" + route.bucketKey());
            target.entry().setUnlimited(false);
        }
    }

    private RestResponse await(CompletableFuture<RestResponse> future, Route route)
        throws InterruptedException, RestException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.log(Level.WARNING, "Request failed route=" + route.routeClass(), cause);
            throw new RestException(route.routeClass() + " request failed: " + cause.getMessage(), cause);
        }
    }

    private BucketRegistry registry(String key) {
        return registries.computeIfAbsent(key, ignored -> new BucketRegistry());
    }

    /**
     * A gate only throttles once it knows a limit; a reported exhaustion without one
     * is recorded as a limit of one.
     */
    private static Integer knownLimit(RateLimitGate gate, Integer reported) {
        if (reported == null && gate.entry().limit() == null) {
            return 1;
        }
        return reported;
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... candidates) {
        for (T candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public void close() {
        exchange.close();
    }

    /**
     * Fields of a 429 JSON body. Missing or unparsable bodies yield no information.
     */
    record RateLimitBody(Duration retryAfter, boolean global) {
        static RateLimitBody parse(RestResponse response) {
            if (response.body().length == 0) {
                return new RateLimitBody(null, false);
            }
            try {
                JsonNode root = JsonCodec.readTree(response.body());
                Duration retryAfter = null;
                JsonNode retry = root.get("retry_after");
                if (retry != null && retry.isNumber() && retry.asDouble() >= 0.0d) {
                    retryAfter = Duration.ofNanos((long) (retry.asDouble() * 1_000_000_000L));
                }
                JsonNode global = root.get("global");
                return new RateLimitBody(retryAfter, global != null && global.asBoolean(false));
            } catch (IOException e) {
                LOG.log(Level.FINE, "Unparsable 429 body", e);
                return new RateLimitBody(null, false);
            }
        }
    }
}
