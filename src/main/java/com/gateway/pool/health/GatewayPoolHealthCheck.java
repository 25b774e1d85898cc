package com.gateway.pool.health;

import com.gateway.pool.connection.GatewayConnectionPool;
import com.gateway.pool.connection.PoolStats;

/**
 * Health check for the gateway connection pool.
 * DOWN when the pool is closed, DEGRADED when a key has grown beyond its idle capacity
 * because all of its connections were in use, UP otherwise.
 */
public class GatewayPoolHealthCheck implements HealthCheck {

    private final GatewayConnectionPool pool;

    public GatewayPoolHealthCheck(GatewayConnectionPool pool) {
        this.pool = pool;
    }

    @Override
    public String getName() {
        return "gatewayConnectionPool";
    }

    @Override
    public HealthStatus check() {
        if (pool.isClosed()) {
            return HealthStatus.down("Gateway connection pool is closed");
        }
        try {
            PoolStats stats = pool.getStats();

            HealthStatus base;
            if (stats.isOverflowing()) {
                base = HealthStatus.degraded("Gateway connections beyond idle capacity: largest key holds "
                        + stats.largestKeySize() + " of " + stats.capacityPerKey());
            } else {
                base = HealthStatus.up();
            }

            return base
                    .withDetail("totalEntries", stats.totalEntries())
                    .withDetail("inUseEntries", stats.inUseEntries())
                    .withDetail("idleEntries", stats.idleEntries())
                    .withDetail("keyCount", stats.keyCount())
                    .withDetail("totalCreated", stats.totalCreated())
                    .withDetail("totalReused", stats.totalReused())
                    .withDetail("totalEvicted", stats.totalEvicted());
        } catch (Exception e) {
            return HealthStatus.down("Gateway connection pool check failed: " + e.getMessage());
        }
    }
}
