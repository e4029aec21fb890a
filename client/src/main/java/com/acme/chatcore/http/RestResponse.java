package com.acme.chatcore.http;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A fully aggregated HTTP response. Header names are stored lower-cased.
 */
public record RestResponse(int status, Map<String, String> headers, byte[] body) {
    public RestResponse {
        Map<String, String> normalized = new HashMap<>();
        if (headers != null) {
            headers.forEach((k, v) -> normalized.put(k.toLowerCase(Locale.ROOT), v));
        }
        headers = Map.copyOf(normalized);
        body = body == null ? new byte[0] : body;
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
