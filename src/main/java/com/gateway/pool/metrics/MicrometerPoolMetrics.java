package com.gateway.pool.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link PoolMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code gateway.pool.acquire} - Timer (tag: path=fast|slow)</li>
 *   <li>{@code gateway.pool.connect.failure} - Counter</li>
 *   <li>{@code gateway.pool.released} - Counter</li>
 *   <li>{@code gateway.pool.evicted} - Counter (tag: reason)</li>
 *   <li>{@code gateway.pool.overflow} - Counter</li>
 * </ul>
 */
public class MicrometerPoolMetrics implements PoolMetrics {

    private final Timer fastAcquireTimer;
    private final Timer slowAcquireTimer;
    private final Counter connectFailureCounter;
    private final Counter releaseCounter;
    private final Counter overflowCounter;
    private final Map<EvictionReason, Counter> evictionCounters = new EnumMap<>(EvictionReason.class);

    public MicrometerPoolMetrics(MeterRegistry registry) {
        this.fastAcquireTimer = acquireTimer(registry, "fast");
        this.slowAcquireTimer = acquireTimer(registry, "slow");
        this.connectFailureCounter = Counter.builder("gateway.pool.connect.failure")
                .description("Number of failed slow-path connection attempts")
                .register(registry);
        this.releaseCounter = Counter.builder("gateway.pool.released")
                .description("Number of connections returned to the pool")
                .register(registry);
        this.overflowCounter = Counter.builder("gateway.pool.overflow")
                .description("Number of admissions beyond the per-key idle capacity")
                .register(registry);
        for (EvictionReason reason : EvictionReason.values()) {
            evictionCounters.put(reason, Counter.builder("gateway.pool.evicted")
                    .description("Number of pooled connections closed by the pool")
                    .tag("reason", reason.name().toLowerCase())
                    .register(registry));
        }
    }

    private static Timer acquireTimer(MeterRegistry registry, String path) {
        return Timer.builder("gateway.pool.acquire")
                .description("Duration of connection acquisition")
                .tag("path", path)
                .register(registry);
    }

    @Override
    public void recordAcquire(boolean reused, Duration duration) {
        (reused ? fastAcquireTimer : slowAcquireTimer).record(duration);
    }

    @Override
    public void recordConnectFailure() {
        connectFailureCounter.increment();
    }

    @Override
    public void recordRelease() {
        releaseCounter.increment();
    }

    @Override
    public void recordEviction(EvictionReason reason, int count) {
        if (count > 0) {
            evictionCounters.get(reason).increment(count);
        }
    }

    @Override
    public void recordOverflow() {
        overflowCounter.increment();
    }
}
