package com.example.gateway.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Retention of status records. Expiry is cache eviction only.
 */
@Validated
@ConfigurationProperties(prefix = "gateway.notification-status")
public record NotificationStatusProperties(
        @DefaultValue("604800") @Positive long ttlSec
) {}
