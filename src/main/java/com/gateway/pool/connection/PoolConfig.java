package com.gateway.pool.connection;

/**
 * Configuration for {@link KeyedGatewayConnectionPool}.
 */
public class PoolConfig {

    /** Default idle TTL: twice the 30s polling interval. */
    public static final long POOL_TTL_MS = 60_000;

    /** Default number of idle connections kept per pool key. */
    public static final int POOL_MAX_PER_KEY = 3;

    private final long ttlMillis;
    private final int maxIdlePerKey;
    private final long evictionIntervalMillis;

    private PoolConfig(Builder builder) {
        this.ttlMillis = builder.ttlMillis;
        this.maxIdlePerKey = builder.maxIdlePerKey;
        this.evictionIntervalMillis = builder.evictionIntervalMillis;
    }

    public long getTtlMillis() { return ttlMillis; }
    public int getMaxIdlePerKey() { return maxIdlePerKey; }
    public long getEvictionIntervalMillis() { return evictionIntervalMillis; }

    /**
     * Returns true when a background sweeper should run in addition to the sweep done on every acquire.
     */
    public boolean isBackgroundEvictionEnabled() {
        return evictionIntervalMillis > 0;
    }

    public static PoolConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long ttlMillis = POOL_TTL_MS;
        private int maxIdlePerKey = POOL_MAX_PER_KEY;
        private long evictionIntervalMillis = 0;

        public Builder ttlMillis(long ttlMillis) {
            if (ttlMillis <= 0) throw new IllegalArgumentException("ttlMillis must be > 0");
            this.ttlMillis = ttlMillis;
            return this;
        }

        public Builder maxIdlePerKey(int maxIdlePerKey) {
            if (maxIdlePerKey <= 0) throw new IllegalArgumentException("maxIdlePerKey must be > 0");
            this.maxIdlePerKey = maxIdlePerKey;
            return this;
        }

        /**
         * Interval of the background eviction sweep. 0 disables it.
         */
        public Builder evictionIntervalMillis(long evictionIntervalMillis) {
            if (evictionIntervalMillis < 0) {
                throw new IllegalArgumentException("evictionIntervalMillis must be >= 0");
            }
            this.evictionIntervalMillis = evictionIntervalMillis;
            return this;
        }

        public PoolConfig build() {
            return new PoolConfig(this);
        }
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "ttlMillis=" + ttlMillis +
                ", maxIdlePerKey=" + maxIdlePerKey +
                ", evictionIntervalMillis=" + evictionIntervalMillis +
                '}';
    }
}
