package com.acme.chatcore.transport;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

@FunctionalInterface
public interface TransportFactory {

    /**
     * Opens a transport and completes the websocket handshake.
     *
     * @throws IOException if the connection or handshake fails or times out
     */
    GatewayTransport connect(URI uri, Duration timeout) throws IOException, InterruptedException;
}
