package com.gateway.pool.connection;

/**
 * An authenticated duplex connection to a gateway daemon.
 * The pool only needs to check whether the connection is still usable and to close it;
 * RPC calls over the connection are issued by the caller that acquired it.
 */
public interface GatewayConnection extends AutoCloseable {

    /**
     * Checks if the underlying socket is open and usable.
     *
     * @return true if the connection can carry requests
     */
    boolean isOpen();

    /**
     * Returns an identifier for diagnostics. Defaults to the identity hash code.
     */
    default String getId() {
        return Integer.toHexString(System.identityHashCode(this));
    }

    /**
     * Closes the connection. Closing an already closed connection has no effect.
     */
    @Override
    void close();
}
