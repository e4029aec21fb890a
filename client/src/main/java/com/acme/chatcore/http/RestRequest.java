package com.acme.chatcore.http;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

public record RestRequest(String method, URI uri, Map<String, String> headers, byte[] body) {
    public RestRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? new byte[0] : body;
    }
}
