package com.example.gateway.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Shared secret of the identity service. Tokens are only verified here, never issued.
 */
@Validated
@ConfigurationProperties(prefix = "gateway.jwt")
public record JwtProperties(
        @NotBlank @Size(min = 32, message = "JWT secret must be at least 32 characters") String secret,
        @DefaultValue("HS256") @NotBlank String algorithm,
        @DefaultValue("3600") long expirationSec
) {}
