package com.gateway.pool.connection;

/**
 * Runtime exception thrown when a new gateway connection cannot be established.
 * The pool propagates it to the caller unchanged and never retries.
 */
public class ConnectionEstablishmentException extends RuntimeException {

    public ConnectionEstablishmentException(String message) {
        super(message);
    }

    public ConnectionEstablishmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
