package com.acme.chatcore.transport;

/**
 * What a {@link GatewayTransport} hands to its reader: a data frame or the close notification.
 */
public sealed interface TransportEvent permits TransportEvent.Message, TransportEvent.Closed {

    record Message(byte[] data, boolean binary) implements TransportEvent {
    }

    /**
     * Terminal event of a transport. {@code code} is {@link #NO_CLOSE_CODE} when the
     * connection dropped without a close frame.
     */
    record Closed(int code, String reason) implements TransportEvent {
        public static final int NO_CLOSE_CODE = -1;

        public Closed {
            reason = reason == null ? "" : reason;
        }

        public boolean hasCode() {
            return code != NO_CLOSE_CODE;
        }
    }
}
