package com.acme.chatcore.gateway;

import java.util.Optional;

/**
 * Why a shard's connection ended.
 *
 * @param closeCode close code, or {@code -1} when the connection dropped without one
 * @param action    what the shard does next
 * @param error     the classified condition for fatal and unrecognised codes
 */
public record DisconnectEvent(int closeCode, String reason, CloseAction action, Optional<GatewayException> error) {

    public DisconnectEvent {
        reason = reason == null ? "" : reason;
        error = error == null ? Optional.empty() : error;
    }

    public boolean resumable() {
        return action == CloseAction.RESUME;
    }
}
