package com.acme.chatcore.transport;

import java.util.concurrent.CompletableFuture;

/**
 * An established duplex frame stream to the gateway.
 *
 * <p>{@link #receive()} yields frames in arrival order and then exactly one
 * {@link TransportEvent.Closed}; calls after that keep returning the same close event.</p>
 */
public interface GatewayTransport extends AutoCloseable {

    CompletableFuture<Void> send(String text);

    /**
     * Blocks until the next event is available.
     */
    TransportEvent receive() throws InterruptedException;

    /**
     * Sends a close frame with {@code code} and drops the connection. Idempotent.
     */
    void close(int code, String reason);

    boolean isOpen();

    @Override
    default void close() {
        close(1000, "");
    }
}
