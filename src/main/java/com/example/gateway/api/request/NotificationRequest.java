package com.example.gateway.api.request;

import com.example.gateway.model.NotificationType;
import com.example.gateway.model.NotificationVariables;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;
import java.util.UUID;

/**
 * Body of {@code POST /api/v1/notifications}. A missing {@code request_id} gets a fresh UUID,
 * so such a request is never deduplicated.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationRequest(
        @NotNull(message = "notification_type is required") NotificationType notificationType,
        @NotNull(message = "user_id is required") UUID userId,
        @NotBlank(message = "template_code cannot be empty") String templateCode,
        @NotNull(message = "variables is required") @Valid NotificationVariables variables,
        String requestId,
        @Min(value = 1, message = "priority must be between 1 and 5")
        @Max(value = 5, message = "priority must be between 1 and 5")
        Integer priority,
        Map<String, Object> metadata
) {
    public NotificationRequest {
        templateCode = templateCode == null ? null : templateCode.strip();
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        if (priority == null) {
            priority = 1;
        }
    }
}
