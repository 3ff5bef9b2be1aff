package io.relay.spi;

/**
 * Unchecked exception for failures of the durable store: a connection that cannot be
 * obtained, or a statement that fails inside a store implementation.
 */
public class RelayStoreException extends RuntimeException {
    public RelayStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
