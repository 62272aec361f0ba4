package io.recovery.spi;

/**
 * Unchecked exception wrapping a backing-store failure (network, timeout,
 * driver error). Facades treat it as transient and degrade to a no-op result.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreException(String message) {
        super(message);
    }
}
