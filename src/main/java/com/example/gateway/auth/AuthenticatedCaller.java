package com.example.gateway.auth;

import java.util.Map;

public record AuthenticatedCaller(
        String userId,
        Map<String, Object> claims
) {}
