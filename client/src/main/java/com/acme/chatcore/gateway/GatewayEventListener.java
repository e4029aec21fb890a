package com.acme.chatcore.gateway;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receives decoded payloads and lifecycle notifications, tagged with the shard index.
 *
 * <p>Called from the shard's reader thread. Implementations should return quickly; an
 * exception thrown from a callback is logged and does not affect the shard.</p>
 */
public interface GatewayEventListener {

    /**
     * Every dispatch payload, READY and RESUMED included.
     */
    default void onDispatch(int shardId, GatewayPayload payload) {
    }

    default void onConnected(int shardId) {
    }

    default void onIdentified(int shardId, String sessionId) {
    }

    default void onResumed(int shardId) {
    }

    default void onDisconnected(int shardId, DisconnectEvent event) {
    }

    /**
     * The shard gave up for good. Called at most once per shard, never for a shard that was
     * closed by its owner.
     */
    default void onTerminated(int shardId, GatewayException cause) {
    }

    default void onStateChanged(int shardId, ShardState from, ShardState to) {
    }

    GatewayEventListener NOOP = new GatewayEventListener() { };

    static GatewayEventListener dispatchOnly(DispatchHandler handler) {
        return new GatewayEventListener() {
            @Override
            public void onDispatch(int shardId, GatewayPayload payload) {
                handler.handle(shardId, payload);
            }
        };
    }

    @FunctionalInterface
    interface DispatchHandler {
        void handle(int shardId, GatewayPayload payload);
    }
}
