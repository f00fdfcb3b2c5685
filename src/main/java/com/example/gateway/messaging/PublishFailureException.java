package com.example.gateway.messaging;

/**
 * The broker was called and the publish did not complete. Counts as a circuit breaker failure.
 */
public class PublishFailureException extends RuntimeException {

    public PublishFailureException(String notificationId, Throwable cause) {
        super("Failed to publish notification " + notificationId, cause);
    }
}
