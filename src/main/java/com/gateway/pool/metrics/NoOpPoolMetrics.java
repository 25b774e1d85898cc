package com.gateway.pool.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link PoolMetrics}.
 */
public class NoOpPoolMetrics implements PoolMetrics {

    @Override
    public void recordAcquire(boolean reused, Duration duration) {
    }

    @Override
    public void recordConnectFailure() {
    }

    @Override
    public void recordRelease() {
    }

    @Override
    public void recordEviction(EvictionReason reason, int count) {
    }

    @Override
    public void recordOverflow() {
    }
}
