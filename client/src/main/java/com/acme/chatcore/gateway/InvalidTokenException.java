package com.acme.chatcore.gateway;

public final class InvalidTokenException extends DisconnectException {
    public InvalidTokenException(int closeCode, String reason) {
        super(closeCode, reason, "Invalid token");
    }
}
