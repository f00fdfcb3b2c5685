package com.example.gateway.api.response;

import com.example.gateway.model.NotificationStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StatusUpdateAck(
        String notificationId,
        NotificationStatus status,
        boolean updated
) {}
