package com.gateway.pool.connection;

/**
 * Keyed pool of authenticated gateway connections.
 * Provides acquire/release semantics that guarantee a connection is held by at most one caller at a time.
 */
public interface GatewayConnectionPool extends AutoCloseable {

    /**
     * Acquires a connection for the given gateway and configuration.
     * Reuses an idle, open, unexpired connection when one exists; otherwise opens a new one.
     *
     * @param gatewayId logical gateway identifier
     * @param config    connection parameters
     * @return a connection owned by the caller until {@link #release}
     * @throws ConnectionEstablishmentException if a new connection cannot be opened
     * @throws IllegalStateException            if the pool is closed
     * @throws IllegalArgumentException         if {@code gatewayId} is blank or {@code config} is null
     */
    GatewayConnection acquire(String gatewayId, ConnectConfig config);

    /**
     * Returns a connection to the pool. A closed connection is removed and closed; an open one
     * becomes idle with a fresh expiry. Unknown connections are ignored.
     *
     * @param connection the connection obtained from {@link #acquire}
     * @param key        the key the connection was acquired under
     */
    void release(GatewayConnection connection, PoolKey key);

    /**
     * Builds the key a connection for this gateway and configuration is pooled under.
     *
     * @throws IllegalArgumentException if {@code gatewayId} is blank or {@code config} is null
     */
    default PoolKey buildKey(String gatewayId, ConnectConfig config) {
        if (gatewayId == null || gatewayId.isBlank()) {
            throw new IllegalArgumentException("gatewayId must not be blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        return PoolKey.of(gatewayId, config);
    }

    /**
     * Acquires a connection wrapped in a lease that releases it on close.
     */
    default GatewayLease acquireLease(String gatewayId, ConnectConfig config) {
        PoolKey key = buildKey(gatewayId, config);
        GatewayConnection connection = acquire(gatewayId, config);
        return new GatewayLease(this, connection, key);
    }

    /**
     * Returns the number of unexpired entries across all keys.
     */
    int poolSize();

    /**
     * Removes and closes expired idle entries.
     *
     * @return the number of entries evicted
     */
    int evictExpired();

    /**
     * Closes every pooled connection, including those in use, and empties the pool.
     */
    void clear();

    /**
     * Returns current pool statistics.
     */
    PoolStats getStats();

    boolean isClosed();

    /**
     * Closes the pool and all managed connections. Further acquires fail.
     */
    @Override
    void close();
}
