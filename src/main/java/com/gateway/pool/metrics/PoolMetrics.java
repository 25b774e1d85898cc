package com.gateway.pool.metrics;

import java.time.Duration;

/**
 * Interface for recording gateway connection pool metrics.
 * The default {@link NoOpPoolMetrics} does nothing, so the pool works
 * without any metrics dependencies on the classpath.
 */
public interface PoolMetrics {

    void recordAcquire(boolean reused, Duration duration);

    void recordConnectFailure();

    void recordRelease();

    void recordEviction(EvictionReason reason, int count);

    void recordOverflow();
}
