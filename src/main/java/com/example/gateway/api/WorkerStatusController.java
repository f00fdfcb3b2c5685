package com.example.gateway.api;

import com.example.gateway.api.request.StatusUpdateRequest;
import com.example.gateway.api.response.StatusUpdateAck;
import com.example.gateway.service.NotificationStatusService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/**
 * Status callbacks from the email and push workers. Service-to-service, no bearer token.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class WorkerStatusController {

    private final NotificationStatusService statusService;

    @PostMapping("/{notificationPreference}/status")
    public ApiResponse<StatusUpdateAck> update(
            @PathVariable String notificationPreference,
            @Valid @RequestBody StatusUpdateRequest request
    ) {
        return ApiResponse.ok(statusService.updateStatus(notificationPreference, request),
                "Notification status updated successfully");
    }
}
