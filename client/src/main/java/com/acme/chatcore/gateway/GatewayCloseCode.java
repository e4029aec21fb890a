package com.acme.chatcore.gateway;

import java.util.HashMap;
import java.util.Map;

/**
 * Close codes the gateway is known to send and what each one means for the shard.
 * New codes are rows here; codes missing from the table fall back to
 * {@link UnhandledCloseCodeException} and a fresh identify.
 */
public enum GatewayCloseCode {
    NORMAL_CLOSURE(1000, CloseAction.IDENTIFY, null),
    GOING_AWAY(1001, CloseAction.RESUME, null),
    UNKNOWN_ERROR(4000, CloseAction.RESUME, null),
    UNKNOWN_OPCODE(4001, CloseAction.RESUME, null),
    DECODE_ERROR(4002, CloseAction.RESUME, null),
    NOT_AUTHENTICATED(4003, CloseAction.RESUME, null),
    AUTHENTICATION_FAILED(4004, CloseAction.FATAL, InvalidTokenException::new),
    ALREADY_AUTHENTICATED(4005, CloseAction.RESUME, null),
    INVALID_SEQUENCE(4007, CloseAction.IDENTIFY, null),
    RATE_LIMITED(4008, CloseAction.RESUME, null),
    SESSION_TIMED_OUT(4009, CloseAction.IDENTIFY, null),
    INVALID_SHARD(4010, CloseAction.FATAL, InvalidShardCountException::new),
    SHARDING_REQUIRED(4011, CloseAction.FATAL, InvalidShardCountException::new),
    INVALID_API_VERSION(4012, CloseAction.FATAL, InvalidApiVersionException::new),
    INVALID_INTENTS(4013, CloseAction.FATAL, InvalidIntentsException::new),
    DISALLOWED_INTENTS(4014, CloseAction.FATAL, DisallowedIntentsException::new);

    private static final Map<Integer, GatewayCloseCode> BY_CODE = new HashMap<>();

    static {
        for (GatewayCloseCode c : values()) {
            BY_CODE.put(c.code, c);
        }
    }

    private final int code;
    private final CloseAction action;
    private final ErrorFactory errorFactory;

    GatewayCloseCode(int code, CloseAction action, ErrorFactory errorFactory) {
        this.code = code;
        this.action = action;
        this.errorFactory = errorFactory;
    }

    public int code() {
        return code;
    }

    public CloseAction action() {
        return action;
    }

    public static GatewayCloseCode fromCode(int code) {
        return BY_CODE.get(code);
    }

    /**
     * Classifies a close. A connection that dropped without a close frame resumes.
     */
    public static Classification classify(int code, String reason) {
        if (code < 0) {
            return new Classification(CloseAction.RESUME, null);
        }
        GatewayCloseCode known = BY_CODE.get(code);
        if (known == null) {
            return new Classification(CloseAction.IDENTIFY, new UnhandledCloseCodeException(code, reason));
        }
        DisconnectException error = known.errorFactory == null ? null : known.errorFactory.create(code, reason);
        return new Classification(known.action, error);
    }

    /**
     * @param error set for fatal and unrecognised codes
     */
    public record Classification(CloseAction action, DisconnectException error) {
    }

    @FunctionalInterface
    private interface ErrorFactory {
        DisconnectException create(int closeCode, String reason);
    }
}
