package com.example.gateway.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "gateway.circuit-breaker")
public record CircuitBreakerProperties(
        @DefaultValue("5") @Positive int failMax,
        @DefaultValue("60") @Positive long timeoutSec
) {}
