package com.gateway.pool.connection;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A connection acquired from a {@link GatewayConnectionPool} together with the key
 * needed to release it. Closing the lease releases the connection exactly once.
 *
 * <pre>
 * try (GatewayLease lease = pool.acquireLease(gatewayId, config)) {
 *     rpcClient.call(lease.connection(), "health");
 * }
 * </pre>
 */
public final class GatewayLease implements AutoCloseable {

    private final GatewayConnectionPool pool;
    private final GatewayConnection connection;
    private final PoolKey key;
    private final AtomicBoolean released = new AtomicBoolean(false);

    GatewayLease(GatewayConnectionPool pool, GatewayConnection connection, PoolKey key) {
        this.pool = pool;
        this.connection = connection;
        this.key = key;
    }

    public GatewayConnection connection() {
        if (released.get()) {
            throw new IllegalStateException("Lease already released");
        }
        return connection;
    }

    public PoolKey key() {
        return key;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            pool.release(connection, key);
        }
    }
}
