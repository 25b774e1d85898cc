package com.gateway.pool.connection;

/**
 * Establishes a new authenticated connection to a gateway.
 * Used by the pool only when no reusable connection is available.
 */
@FunctionalInterface
public interface GatewayConnector {

    /**
     * Opens a connection and completes the gateway handshake.
     *
     * @param config the connection parameters
     * @return an open connection
     * @throws ConnectionEstablishmentException if the connection or handshake fails
     */
    GatewayConnection connect(ConnectConfig config);
}
