package com.acme.chatcore.gateway;

/**
 * The reconnect policy refused another attempt; the shard stops until restarted externally.
 */
public final class ReconnectCheckFailedException extends GatewayException {
    private final int shardId;
    private final int attempt;

    public ReconnectCheckFailedException(int shardId, int attempt, Throwable lastFailure) {
        super("Reconnect rejected for shard " + shardId + " at attempt " + attempt, lastFailure);
        this.shardId = shardId;
        this.attempt = attempt;
    }

    public int shardId() {
        return shardId;
    }

    public int attempt() {
        return attempt;
    }
}
