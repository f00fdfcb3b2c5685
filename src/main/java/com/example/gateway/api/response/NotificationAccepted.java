package com.example.gateway.api.response;

import com.example.gateway.model.NotificationStatus;
import com.example.gateway.model.NotificationType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationAccepted(
        String notificationId,
        NotificationStatus status,
        String requestId,
        NotificationType notificationType
) {}
