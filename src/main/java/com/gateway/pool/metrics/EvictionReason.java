package com.gateway.pool.metrics;

/**
 * Why the pool closed a connection it was tracking.
 */
public enum EvictionReason {
    /** Idle past its TTL. */
    EXPIRED,
    /** Reported closed on acquire scan or release. */
    UNHEALTHY,
    /** Oldest idle entry removed to admit a new connection. */
    CAPACITY,
    /** Removed by pool teardown. */
    CLEARED
}
