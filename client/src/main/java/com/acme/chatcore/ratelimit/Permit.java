package com.acme.chatcore.ratelimit;

/**
 * A granted slot on a {@link RateLimitGate}, held for one unit of work.
 *
 * <p>Closing the permit only lets the next waiter be considered; it has no other effect.
 * A permit must be closed by the thread that acquired it, normally through
 * try-with-resources.</p>
 */
public interface Permit extends AutoCloseable {

    /**
     * A permit with nothing to release.
     */
    Permit NONE = () -> { };

    @Override
    void close();
}
