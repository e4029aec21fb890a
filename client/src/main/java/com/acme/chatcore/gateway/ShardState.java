package com.acme.chatcore.gateway;

public enum ShardState {
    DISCONNECTED,
    /** Transport open, waiting for HELLO. */
    CONNECTING,
    /** Waiting for the identify throttle, then identifying. */
    IDENTIFYING,
    RESUMING,
    READY,
    RECONNECTING
}
