package com.example.gateway.store;

/**
 * The key-value store could not be reached or rejected the command.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
