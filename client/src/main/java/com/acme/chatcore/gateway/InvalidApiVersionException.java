package com.acme.chatcore.gateway;

public final class InvalidApiVersionException extends DisconnectException {
    public InvalidApiVersionException(int closeCode, String reason) {
        super(closeCode, reason, "Invalid gateway API version");
    }
}
