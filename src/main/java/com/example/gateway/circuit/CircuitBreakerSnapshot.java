package com.example.gateway.circuit;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CircuitBreakerSnapshot(
        String state,
        int failureCount,
        Instant lastFailure
) {}
