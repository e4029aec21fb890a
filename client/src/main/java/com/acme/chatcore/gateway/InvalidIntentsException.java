package com.acme.chatcore.gateway;

public final class InvalidIntentsException extends DisconnectException {
    public InvalidIntentsException(int closeCode, String reason) {
        super(closeCode, reason, "Invalid intents");
    }
}
