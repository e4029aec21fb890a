package com.acme.chatcore.gateway;

/**
 * A connection closed by the server with a code that classifies the failure.
 */
public class DisconnectException extends GatewayException {
    private final int closeCode;
    private final String reason;

    public DisconnectException(int closeCode, String reason, String message) {
        super(message + " (code=" + closeCode + (reason == null || reason.isEmpty() ? "" : ", reason=" + reason) + ")");
        this.closeCode = closeCode;
        this.reason = reason == null ? "" : reason;
    }

    public int closeCode() {
        return closeCode;
    }

    public String reason() {
        return reason;
    }
}
