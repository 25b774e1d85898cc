package com.gateway.pool.health;

/**
 * A named probe of one component's health.
 */
public interface HealthCheck {

    String getName();

    /**
     * Runs the probe. Implementations report failures as a DOWN status rather than throwing.
     */
    HealthStatus check();
}
