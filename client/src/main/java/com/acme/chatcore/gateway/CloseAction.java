package com.acme.chatcore.gateway;

/**
 * What a shard does after its connection ends.
 */
public enum CloseAction {
    /** Reconnect and resume the existing session. */
    RESUME,
    /** Reconnect with a fresh identify; the session is dropped. */
    IDENTIFY,
    /** Stop for good. */
    FATAL
}
