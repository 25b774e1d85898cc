package com.gateway.pool.connection;

/**
 * A pooled connection together with its bookkeeping.
 * All mutable state is guarded by the owning pool's lock.
 */
final class PoolEntry {

    private final GatewayConnection connection;
    private long expiresAt;
    private boolean inUse;

    PoolEntry(GatewayConnection connection, long now, long ttlMillis) {
        this.connection = connection;
        this.expiresAt = now + ttlMillis;
        this.inUse = true;
    }

    GatewayConnection connection() { return connection; }
    long expiresAt() { return expiresAt; }
    boolean inUse() { return inUse; }

    boolean isExpired(long now) {
        return now >= expiresAt;
    }

    /**
     * Hands the entry to a caller and extends its lifetime.
     */
    void checkout(long now, long ttlMillis) {
        inUse = true;
        expiresAt = now + ttlMillis;
    }

    /**
     * Returns the entry to the idle set and extends its lifetime.
     */
    void checkin(long now, long ttlMillis) {
        inUse = false;
        expiresAt = now + ttlMillis;
    }
}
