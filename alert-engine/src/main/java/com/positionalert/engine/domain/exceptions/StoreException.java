package com.positionalert.engine.domain.exceptions;

/** Read or write failure against the alert state store. */
public class StoreException extends RuntimeException {

    private StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public static StoreException readFailed(String key, Throwable cause) {
        return new StoreException("Failed to read alert state for " + key, cause);
    }

    public static StoreException writeFailed(String key, Throwable cause) {
        return new StoreException("Failed to write alert state for " + key, cause);
    }
}
