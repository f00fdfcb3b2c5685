package com.example.gateway.api.request;

import com.example.gateway.model.NotificationStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Sent by the email/push workers. {@code timestamp} defaults to the time of receipt.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StatusUpdateRequest(
        @NotBlank(message = "notification_id is required") String notificationId,
        @NotNull(message = "status is required") NotificationStatus status,
        String timestamp,
        String error
) {}
