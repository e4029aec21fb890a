package com.acme.chatcore.http;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * One REST endpoint invocation: method, path template and the values filling it.
 *
 * <p>The route-class (method + template) plus the major parameters identify the
 * rate-limit bucket a request is charged against until the server reveals the real
 * bucket hash.</p>
 */
public record Route(String method, String pathTemplate, Map<String, String> parameters, boolean ignoreGlobal) {
    private static final Set<String> MAJOR_PARAMETERS = Set.of("channel_id", "guild_id", "webhook_id", "webhook_token");

    public Route {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(pathTemplate, "pathTemplate");
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    /**
     * Builds a route from alternating parameter names and values,
     * e.g. {@code Route.of("GET", "/channels/{channel_id}", "channel_id", 123)}.
     */
    public static Route of(String method, String pathTemplate, Object... nameValuePairs) {
        if (nameValuePairs.length % 2 != 0) {
            throw new IllegalArgumentException("parameters must be name/value pairs");
        }
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i < nameValuePairs.length; i += 2) {
            params.put(String.valueOf(nameValuePairs[i]), String.valueOf(nameValuePairs[i + 1]));
        }
        return new Route(method, pathTemplate, params, false);
    }

    public Route ignoringGlobal() {
        return new Route(method, pathTemplate, parameters, true);
    }

    public String path() {
        String path = pathTemplate;
        for (Map.Entry<String, String> e : parameters.entrySet()) {
            String encoded = URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8).replace("+", "%20");
            path = path.replace("{" + e.getKey() + "}", encoded);
        }
        return path;
    }

    public String routeClass() {
        return method + " " + pathTemplate;
    }

    public String majorParameters() {
        StringJoiner joiner = new StringJoiner(";");
        new TreeMap<>(parameters).forEach((k, v) -> {
            if (MAJOR_PARAMETERS.contains(k)) {
                joiner.add(k + "=" + v);
            }
        });
        return joiner.toString();
    }

    public String bucketKey() {
        return routeClass() + "|" + majorParameters();
    }
}
