package com.acme.chatcore.http;

import com.acme.chatcore.telemetry.NoopClientMetrics;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;

import static com.acme.chatcore.http.ScriptedExchange.response;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GatewayHttpClientTest {
    private static final String BASE = "https://api.test/v10";

    private static GatewayHttpClient client(ScriptedExchange exchange) {
        return new GatewayHttpClient(new RestDispatcher(exchange, BASE, NoopClientMetrics.INSTANCE, 1));
    }

    @Test
    void shouldReadGatewayUrlWithoutAuthorization() throws Exception {
        ScriptedExchange exchange = new ScriptedExchange()
            .then(response(200, "{\"url\":\"wss://gateway.test\"}"));

        String url = client(exchange).getGateway();

        assertEquals("wss://gateway.test", url);
        RestRequest sent = exchange.requests().get(0);
        assertEquals(URI.create(BASE + "/gateway"), sent.uri());
        assertFalse(sent.headers().containsKey("Authorization"));
    }

    @Test
    void shouldParseGatewayBotInfo() throws Exception {
        ScriptedExchange exchange = new ScriptedExchange()
            .then(response(200, "{\"url\":\"wss://gateway.test\",\"shards\":6,"
                + "\"session_start_limit\":{\"total\":1000,\"remaining\":997,"
                + "\"reset_after\":14400000,\"max_concurrency\":2}}"));

        GatewayBotInfo info = client(exchange).getGatewayBot("abc");

        assertEquals("wss://gateway.test", info.url());
        assertEquals(6, info.shards());
        assertEquals(1000, info.sessionStartLimit().total());
        assertEquals(997, info.sessionStartLimit().remaining());
        assertEquals(Duration.ofHours(4), info.sessionStartLimit().resetAfter());
        assertEquals(2, info.sessionStartLimit().maxConcurrency());
        RestRequest sent = exchange.requests().get(0);
        assertEquals(URI.create(BASE + "/gateway/bot"), sent.uri());
        assertEquals("Bot abc", sent.headers().get("Authorization"));
    }

    @Test
    void shouldDefaultMissingConcurrencyToOne() throws Exception {
        ScriptedExchange exchange = new ScriptedExchange()
            .then(response(200, "{\"url\":\"wss://gateway.test\",\"shards\":1}"));

        GatewayBotInfo info = client(exchange).getGatewayBot("abc");

        assertEquals(1, info.sessionStartLimit().maxConcurrency());
    }

    @Test
    void shouldRejectResponseWithoutUrl() {
        ScriptedExchange exchange = new ScriptedExchange().then(response(200, "{\"shards\":2}"));

        RestException error = assertThrows(RestException.class, () -> client(exchange).getGatewayBot("abc"));

        assertTrue(error.getMessage().contains("url"));
    }

    @Test
    void shouldKeepExplicitAuthorizationScheme() {
        assertEquals("Bot abc", GatewayHttpClient.authorization("abc"));
        assertEquals("Bot abc", GatewayHttpClient.authorization("Bot abc"));
        assertEquals("Bearer xyz", GatewayHttpClient.authorization("Bearer xyz"));
    }
}
