package com.gateway.pool.cdi;

import com.gateway.pool.connection.GatewayConnectionPool;
import com.gateway.pool.connection.GatewayConnector;
import com.gateway.pool.connection.KeyedGatewayConnectionPool;
import com.gateway.pool.connection.PoolConfig;
import com.gateway.pool.health.GatewayPoolHealthCheck;
import com.gateway.pool.health.HealthCheckRegistry;
import com.gateway.pool.metrics.MicrometerPoolMetrics;
import com.gateway.pool.tracing.OpenTelemetryTracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CDI producer that creates the process-wide gateway connection pool from MicroProfile Config.
 *
 * <p>The application supplies a {@link GatewayConnector} bean; the pool is produced once per
 * application and closed when the container shuts down. A {@link MeterRegistry} or an
 * OpenTelemetry {@link Tracer} bean, when present, is used for metrics and tracing.</p>
 *
 * <pre>
 * gateway-pool:
 *   ttl-millis: 60000
 *   max-idle-per-key: 3
 *   eviction-interval-millis: 30000
 * </pre>
 */
@ApplicationScoped
public class GatewayPoolProducer {

    private static final Logger log = LoggerFactory.getLogger(GatewayPoolProducer.class);

    @Inject
    @ConfigProperty(name = "gateway-pool.ttl-millis", defaultValue = "60000")
    long ttlMillis;

    @Inject
    @ConfigProperty(name = "gateway-pool.max-idle-per-key", defaultValue = "3")
    int maxIdlePerKey;

    @Inject
    @ConfigProperty(name = "gateway-pool.eviction-interval-millis", defaultValue = "30000")
    long evictionIntervalMillis;

    @Inject
    GatewayConnector connector;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Inject
    Instance<Tracer> tracer;

    PoolConfig poolConfig() {
        return PoolConfig.builder()
                .ttlMillis(ttlMillis)
                .maxIdlePerKey(maxIdlePerKey)
                .evictionIntervalMillis(evictionIntervalMillis)
                .build();
    }

    @Produces
    @ApplicationScoped
    public GatewayConnectionPool gatewayConnectionPool() {
        KeyedGatewayConnectionPool.Builder builder = KeyedGatewayConnectionPool.builder(connector)
                .config(poolConfig());

        if (meterRegistry != null && meterRegistry.isResolvable()) {
            builder.metrics(new MicrometerPoolMetrics(meterRegistry.get()));
            log.info("Gateway pool metrics enabled");
        }
        if (tracer != null && tracer.isResolvable()) {
            builder.tracing(new OpenTelemetryTracingService(tracer.get()));
            log.info("Gateway pool tracing enabled");
        }

        return builder.build();
    }

    public void closeGatewayConnectionPool(@Disposes GatewayConnectionPool pool) {
        log.info("Closing gateway connection pool");
        pool.close();
    }

    @Produces
    @ApplicationScoped
    public GatewayPoolHealthCheck gatewayPoolHealthCheck(GatewayConnectionPool pool) {
        return new GatewayPoolHealthCheck(pool);
    }

    @Produces
    @ApplicationScoped
    public HealthCheckRegistry healthCheckRegistry(GatewayPoolHealthCheck poolHealthCheck) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(poolHealthCheck);
        return registry;
    }
}
