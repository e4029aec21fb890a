package com.acme.chatcore.gateway;

/**
 * Base of the conditions a shard can surface to its owner.
 */
public class GatewayException extends Exception {
    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
