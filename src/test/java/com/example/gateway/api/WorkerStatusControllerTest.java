package com.example.gateway.api;

import com.example.gateway.api.request.StatusUpdateRequest;
import com.example.gateway.api.response.StatusUpdateAck;
import com.example.gateway.model.NotificationStatus;
import com.example.gateway.service.InvalidNotificationRequestException;
import com.example.gateway.service.NotificationNotFoundException;
import com.example.gateway.service.NotificationStatusService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WorkerStatusController.class)
class WorkerStatusControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private NotificationStatusService statusService;

    @Test
    void workerReportIsAcknowledged() throws Exception {
        when(statusService.updateStatus(eq("email"), any(StatusUpdateRequest.class)))
                .thenReturn(new StatusUpdateAck("n-1", NotificationStatus.DELIVERED, true));

        mockMvc.perform(post("/api/v1/email/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"notification_id": "n-1", "status": "delivered", "timestamp": "2026-01-01T00:05:00Z"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.notification_id").value("n-1"))
                .andExpect(jsonPath("$.data.updated").value(true))
                .andExpect(jsonPath("$.message").value("Notification status updated successfully"));

        verify(statusService).updateStatus("email",
                new StatusUpdateRequest("n-1", NotificationStatus.DELIVERED, "2026-01-01T00:05:00Z", null));
    }

    @Test
    void unknownNotificationIs404() throws Exception {
        when(statusService.updateStatus(eq("push"), any(StatusUpdateRequest.class)))
                .thenThrow(new NotificationNotFoundException("ghost"));

        mockMvc.perform(post("/api/v1/push/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"notification_id": "ghost", "status": "failed", "error": "bounced"}
                                """))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void invalidPreferenceIs400() throws Exception {
        when(statusService.updateStatus(eq("sms"), any(StatusUpdateRequest.class)))
                .thenThrow(new InvalidNotificationRequestException(
                        "Invalid notification preference. Must be 'email' or 'push'"));

        mockMvc.perform(post("/api/v1/sms/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"notification_id": "n-1", "status": "delivered"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid notification preference. Must be 'email' or 'push'"));
    }

    @Test
    void unknownStatusValueIsMalformed() throws Exception {
        mockMvc.perform(post("/api/v1/email/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"notification_id": "n-1", "status": "bounced"}
                                """))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(statusService);
    }

    @Test
    void missingNotificationIdIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/email/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"status": "delivered"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("notification_id is required"));
    }
}
