package com.acme.chatcore.gateway;

public final class InvalidShardCountException extends DisconnectException {
    public InvalidShardCountException(int closeCode, String reason) {
        super(closeCode, reason, "Invalid shard or shard count");
    }
}
