package com.gateway.pool.connection;

/**
 * Statistics for a {@link GatewayConnectionPool}.
 *
 * @param totalEntries     number of pooled entries (in use + idle)
 * @param inUseEntries     entries currently held by callers
 * @param idleEntries      entries available for reuse
 * @param keyCount         number of distinct pool keys
 * @param largestKeySize   number of entries under the most populated key
 * @param capacityPerKey   configured idle capacity per key
 * @param totalAcquired    cumulative successful acquire count
 * @param totalReleased    cumulative release count for tracked connections
 * @param totalCreated     cumulative connections opened on the slow path
 * @param totalReused      cumulative fast-path acquisitions
 * @param totalEvicted     cumulative entries closed by the pool
 */
public record PoolStats(
        int totalEntries,
        int inUseEntries,
        int idleEntries,
        int keyCount,
        int largestKeySize,
        int capacityPerKey,
        long totalAcquired,
        long totalReleased,
        long totalCreated,
        long totalReused,
        long totalEvicted
) {

    /**
     * Returns true when some key holds more entries than its idle capacity,
     * which only happens when every entry of that key was in use at admission time.
     */
    public boolean isOverflowing() {
        return largestKeySize > capacityPerKey;
    }
}
