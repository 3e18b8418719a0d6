package com.tandem.core.error;

/**
 * Thrown when the backing store fails to read or write. Prior state is left intact.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
