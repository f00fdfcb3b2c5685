package com.example.gateway.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationStatusRecord(
        String notificationId,
        NotificationStatus status,
        NotificationType notificationType,
        String userId,
        String templateCode,
        String createdAt,
        String updatedAt,
        String errorMessage
) {
    public static NotificationStatusRecord pending(NotificationJob job) {
        return new NotificationStatusRecord(
                job.notificationId(),
                NotificationStatus.PENDING,
                job.notificationType(),
                job.userId(),
                job.templateCode(),
                job.createdAt(),
                null,
                null);
    }

    public NotificationStatusRecord merge(
            NotificationStatus newStatus,
            NotificationType reportedBy,
            String updatedAt,
            String errorMessage
    ) {
        return new NotificationStatusRecord(
                notificationId,
                newStatus,
                reportedBy,
                userId,
                templateCode,
                createdAt,
                updatedAt,
                errorMessage);
    }
}
