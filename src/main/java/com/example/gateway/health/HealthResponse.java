package com.example.gateway.health;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        String status,
        String service,
        String timestamp,
        String version,
        Map<String, Object> checks,
        String message
) {}
