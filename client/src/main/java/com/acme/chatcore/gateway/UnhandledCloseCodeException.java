package com.acme.chatcore.gateway;

/**
 * The server closed with a code this client does not recognise. Not fatal: the shard
 * re-identifies.
 */
public final class UnhandledCloseCodeException extends DisconnectException {
    public UnhandledCloseCodeException(int closeCode, String reason) {
        super(closeCode, reason, "Unhandled close code");
    }
}
