package com.example.gateway.circuit;

/**
 * The protected call was rejected without being attempted.
 */
public class CircuitOpenException extends RuntimeException {

    private final String circuit;

    public CircuitOpenException(String circuit) {
        super("Service temporarily unavailable (circuit breaker " + circuit + " open)");
        this.circuit = circuit;
    }

    public String circuit() {
        return circuit;
    }
}
