package com.acme.chatcore.http;

import com.acme.chatcore.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Wrappers for the two gateway discovery endpoints.
 */
public final class GatewayHttpClient {
    static final Route GATEWAY = new Route("GET", "/gateway", Map.of(), true);
    static final Route GATEWAY_BOT = new Route("GET", "/gateway/bot", Map.of(), false);

    private final RestDispatcher dispatcher;

    public GatewayHttpClient(RestDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    /**
     * Unauthenticated gateway URL lookup. Not subject to the global limiter.
     */
    public String getGateway() throws InterruptedException, RestException {
        RestResponse response = dispatcher.request(GATEWAY, null);
        return requireText(parse(response), "url");
    }

    public GatewayBotInfo getGatewayBot(String token) throws InterruptedException, RestException {
        Objects.requireNonNull(token, "token");
        RestResponse response = dispatcher.request(GATEWAY_BOT, token,
            Map.of("Authorization", authorization(token)), null, true);
        JsonNode root = parse(response);
        JsonNode limit = root.path("session_start_limit");
        return new GatewayBotInfo(
            requireText(root, "url"),
            root.path("shards").asInt(1),
            new GatewayBotInfo.SessionStartLimit(
                limit.path("total").asInt(0),
                limit.path("remaining").asInt(0),
                Duration.ofMillis(limit.path("reset_after").asLong(0L)),
                Math.max(1, limit.path("max_concurrency").asInt(1))
            )
        );
    }

    static String authorization(String token) {
        return token.startsWith("Bot ") || token.startsWith("Bearer ") ? token : "Bot " + token;
    }

    private static JsonNode parse(RestResponse response) throws RestException {
        try {
            return JsonCodec.readTree(response.body());
        } catch (IOException e) {
            throw new RestException("Malformed gateway response", e);
        }
    }

    private static String requireText(JsonNode root, String field) throws RestException {
        JsonNode value = root.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new RestException(-1, null, "Gateway response missing '" + field + "'");
        }
        return value.asText();
    }
}
