package com.example.gateway.service;

import com.example.gateway.api.PaginationMeta;
import com.example.gateway.api.request.StatusUpdateRequest;
import com.example.gateway.api.response.StatusUpdateAck;
import com.example.gateway.auth.AuthValidator;
import com.example.gateway.auth.AuthenticatedCaller;
import com.example.gateway.metrics.NotificationMetrics;
import com.example.gateway.model.NotificationStatusRecord;
import com.example.gateway.model.NotificationType;
import com.example.gateway.store.NotificationStatusStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationStatusService {

    static final int MAX_PAGE_SIZE = 100;

    private final AuthValidator authValidator;
    private final NotificationStatusStore statusStore;
    private final NotificationMetrics metrics;
    private final Clock clock;

    public NotificationStatusRecord getStatus(String authorization, String notificationId) {
        authValidator.verifyHeader(authorization);
        return statusStore.find(notificationId)
                .orElseThrow(() -> new NotificationNotFoundException(notificationId));
    }

    /**
     * Merges a worker's report into an existing record. Never creates one.
     */
    public StatusUpdateAck updateStatus(String notificationPreference, StatusUpdateRequest request) {
        NotificationType reportedBy = NotificationType.find(notificationPreference)
                .orElseThrow(() -> new InvalidNotificationRequestException(
                        "Invalid notification preference. Must be 'email' or 'push'"));

        String updatedAt = request.timestamp() != null && !request.timestamp().isBlank()
                ? request.timestamp()
                : Instant.now(clock).toString();

        statusStore.update(request.notificationId(),
                        current -> current.merge(request.status(), reportedBy, updatedAt, request.error()))
                .orElseThrow(() -> new NotificationNotFoundException(request.notificationId()));

        metrics.recordStatusUpdate(request.status().value());
        log.info("event=notify_status_updated notificationId={} status={} reportedBy={}",
                request.notificationId(), request.status().value(), reportedBy.value());
        return new StatusUpdateAck(request.notificationId(), request.status(), true);
    }

    /**
     * The caller's status records, newest first.
     */
    public NotificationPage list(String authorization, int page, int limit) {
        AuthenticatedCaller caller = authValidator.verifyHeader(authorization);
        if (page < 1) {
            throw new InvalidNotificationRequestException("page must be >= 1");
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new InvalidNotificationRequestException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }

        List<NotificationStatusRecord> all = statusStore.findByUser(caller.userId()).stream()
                .sorted(Comparator.comparing(NotificationStatusRecord::createdAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();

        int from = (int) Math.min((long) (page - 1) * limit, all.size());
        int to = Math.min(from + limit, all.size());
        return new NotificationPage(all.subList(from, to), PaginationMeta.of(all.size(), page, limit));
    }
}
