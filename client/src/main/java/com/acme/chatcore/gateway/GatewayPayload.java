package com.acme.chatcore.gateway;

import com.acme.chatcore.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;

/**
 * One gateway message: opcode, data, sequence and event name.
 */
public record GatewayPayload(int op, JsonNode d, Long s, String t) {

    public GatewayPayload {
        d = d == null ? NullNode.getInstance() : d;
    }

    public static GatewayPayload parse(byte[] raw) throws IOException {
        JsonNode root = JsonCodec.readTree(raw);
        JsonNode op = root == null ? null : root.get("op");
        if (op == null || !op.canConvertToInt()) {
            throw new IOException("Gateway payload without opcode");
        }
        JsonNode s = root.get("s");
        JsonNode t = root.get("t");
        return new GatewayPayload(
            op.asInt(),
            root.get("d"),
            s == null || s.isNull() ? null : s.asLong(),
            t == null || t.isNull() ? null : t.asText()
        );
    }

    public GatewayOpcode opcode() {
        return GatewayOpcode.fromCode(op);
    }

    public String toJson() throws JsonProcessingException {
        ObjectNode root = JsonCodec.objectNode();
        root.put("op", op);
        root.set("d", d);
        if (s != null) {
            root.put("s", s);
        }
        if (t != null) {
            root.put("t", t);
        }
        return JsonCodec.writeString(root);
    }

    public static GatewayPayload of(GatewayOpcode op, JsonNode d) {
        return new GatewayPayload(op.code(), d, null, null);
    }

    public static GatewayPayload heartbeat(Long sequence) {
        JsonNode d = sequence == null ? NullNode.getInstance() : LongNode.valueOf(sequence);
        return of(GatewayOpcode.HEARTBEAT, d);
    }

    public static GatewayPayload identify(String token,
                                          long intents,
                                          int shardId,
                                          int shardCount,
                                          JsonNode presence,
                                          Integer largeThreshold) {
        ObjectNode d = JsonCodec.objectNode();
        d.put("token", token);
        d.put("intents", intents);
        ObjectNode properties = d.putObject("properties");
        properties.put("os", System.getProperty("os.name", "unknown"));
        properties.put("browser", "chatcore");
        properties.put("device", "chatcore");
        d.putArray("shard").add(shardId).add(shardCount);
        if (presence != null && !presence.isNull()) {
            d.set("presence", presence);
        }
        if (largeThreshold != null) {
            d.put("large_threshold", largeThreshold);
        }
        return of(GatewayOpcode.IDENTIFY, d);
    }

    public static GatewayPayload resume(String token, String sessionId, Long sequence) {
        ObjectNode d = JsonCodec.objectNode();
        d.put("token", token);
        d.put("session_id", sessionId);
        if (sequence == null) {
            d.putNull("seq");
        } else {
            d.put("seq", sequence);
        }
        return of(GatewayOpcode.RESUME, d);
    }
}
