package com.acme.chatcore.gateway;

public final class DisallowedIntentsException extends DisconnectException {
    public DisallowedIntentsException(int closeCode, String reason) {
        super(closeCode, reason, "Disallowed intents");
    }
}
