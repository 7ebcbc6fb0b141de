package com.racing.reconcile.bulk;

/**
 * Thrown when a batch document cannot be read or is not shaped as expected.
 */
public class BatchLoadException extends RuntimeException {

    public BatchLoadException(String message) {
        super(message);
    }

    public BatchLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
