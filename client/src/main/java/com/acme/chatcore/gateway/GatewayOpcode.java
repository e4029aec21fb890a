package com.acme.chatcore.gateway;

public enum GatewayOpcode {
    DISPATCH(0),
    HEARTBEAT(1),
    IDENTIFY(2),
    PRESENCE_UPDATE(3),
    VOICE_STATE_UPDATE(4),
    RESUME(6),
    RECONNECT(7),
    REQUEST_GUILD_MEMBERS(8),
    INVALID_SESSION(9),
    HELLO(10),
    HEARTBEAT_ACK(11);

    private static final GatewayOpcode[] BY_CODE = new GatewayOpcode[12];

    static {
        for (GatewayOpcode op : values()) {
            BY_CODE[op.code] = op;
        }
    }

    private final int code;

    GatewayOpcode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @return the opcode, or {@code null} for codes this client does not know
     */
    public static GatewayOpcode fromCode(int code) {
        return code >= 0 && code < BY_CODE.length ? BY_CODE[code] : null;
    }
}
