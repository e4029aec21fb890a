package com.acme.chatcore.http;

import com.acme.chatcore.ratelimit.LedgerEntry;
import com.acme.chatcore.ratelimit.RateLimitGate;

import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Maps routes to gates and merges route-classes that turn out to share a server bucket.
 *
 * <p>One registry per rate-limit key (authentication). Gates start keyed by route-class
 * and major parameters; once a response reveals the bucket hash, later lookups for any
 * route-class carrying that hash resolve to the hash owner's gate.</p>
 */
final class BucketRegistry {
    private static final Logger LOG = Logger.getLogger(BucketRegistry.class.getName());

    private final Map<String, RateLimitGate> gatesByRoute = new HashMap<>();
    private final Map<String, RateLimitGate> gatesByHash = new HashMap<>();
    private final Map<String, String> hashByRouteClass = new HashMap<>();

    synchronized RateLimitGate gateFor(Route route) {
        RateLimitGate gate = gatesByRoute.get(route.bucketKey());
        if (gate != null) {
            return gate;
        }
        String hash = hashByRouteClass.get(route.routeClass());
        String hashKey = hash == null ? null : hashKey(hash, route);
        if (hashKey != null) {
            gate = gatesByHash.get(hashKey);
        }
        if (gate == null) {
            gate = new RateLimitGate(new LedgerEntry());
            if (hashKey != null) {
                gatesByHash.put(hashKey, gate);
            }
        }
        gatesByRoute.put(route.bucketKey(), gate);
        return gate;
    }

    /**
     * Records that {@code route} is charged against bucket {@code hash} and returns the
     * gate that should receive the response's update.
     *
     * <p>Must be called by the permit holder of {@code used}. A clean {@code used} gate
     * has nothing to reconcile and is simply replaced by the owner; a dirty one is
     * rebound to the owner's ledger entry so in-flight holders share its state.</p>
     */
    synchronized RateLimitGate bindBucket(Route route, RateLimitGate used, String hash) {
        String previous = hashByRouteClass.put(route.routeClass(), hash);
        if (previous != null && !previous.equals(hash)) {
            LOG.fine(() -> "Bucket hash changed route=" + route.routeClass() + " from=" + previous + " to=" + hash);
        }
        String hashKey = hashKey(hash, route);
        RateLimitGate owner = gatesByHash.putIfAbsent(hashKey, used);
        if (owner == null || owner == used) {
            return used;
        }
        gatesByRoute.put(route.bucketKey(), owner);
        if (used.isDirty()) {
            used.rebind(owner.entry());
            LOG.fine(() -> "Merged route=" + route.bucketKey() + " into shared bucket=" + hash);
            return used;
        }
        return owner;
    }

    synchronized int size() {
        return gatesByRoute.size();
    }

    private static String hashKey(String hash, Route route) {
        return hash + "|" + route.majorParameters();
    }
}
