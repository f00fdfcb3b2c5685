package com.example.gateway.api;

import com.example.gateway.api.request.NotificationRequest;
import com.example.gateway.api.response.NotificationAccepted;
import com.example.gateway.config.CorrelationIdFilter;
import com.example.gateway.model.NotificationStatusRecord;
import com.example.gateway.service.NotificationOrchestrator;
import com.example.gateway.service.NotificationPage;
import com.example.gateway.service.NotificationStatusService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationOrchestrator orchestrator;
    private final NotificationStatusService statusService;

    @PostMapping
    public ResponseEntity<ApiResponse<NotificationAccepted>> send(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestAttribute(value = CorrelationIdFilter.ATTRIBUTE, required = false) String correlationId,
            @Valid @RequestBody NotificationRequest request
    ) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(orchestrator.accept(authorization, request, correlationId));
    }

    @GetMapping("/{notificationId}/status")
    public ApiResponse<NotificationStatusRecord> status(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String notificationId
    ) {
        return ApiResponse.ok(statusService.getStatus(authorization, notificationId),
                "Notification status retrieved");
    }

    @GetMapping
    public ApiResponse<List<NotificationStatusRecord>> list(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit
    ) {
        NotificationPage result = statusService.list(authorization, page, limit);
        return ApiResponse.page(result.items(), "Notifications retrieved", result.meta());
    }
}
