package com.example.gateway.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * Queue message for the email/push workers. {@code notificationId} is the join key with the status record.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationJob(
        String notificationId,
        String correlationId,
        String userId,
        NotificationType notificationType,
        String templateCode,
        NotificationVariables variables,
        int priority,
        Map<String, Object> metadata,
        String createdAt,
        int retryCount
) {
    public String routingKey() {
        return notificationType.routingKey();
    }
}
