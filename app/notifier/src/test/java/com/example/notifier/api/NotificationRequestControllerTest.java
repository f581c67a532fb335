/*
 * Where: Notifier API web layer tests
 * What: Status codes, Location header and error shape of the request endpoints
 * Why: Clients rely on one error body and on 201 with a resource location
 */
package com.example.notifier.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.notifier.api.request.CreateNotificationRequest;
import com.example.notifier.model.NotificationPhase;
import com.example.notifier.model.NotificationRequest;
import com.example.notifier.model.NotificationRequestSpec;
import com.example.notifier.model.NotificationRequestStatus;
import com.example.notifier.model.Priority;
import com.example.notifier.model.Recipient;
import com.example.notifier.service.InvalidNotificationRequestException;
import com.example.notifier.service.NotificationRequestNotFoundException;
import com.example.notifier.service.NotificationRequestService;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(NotificationRequestController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class NotificationRequestControllerTest {

  private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");
  private static final UUID ID = UUID.fromString("33333333-3333-3333-3333-333333333333");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private NotificationRequestService service;

  @Test
  void createReturns201WithLocation() throws Exception {
    when(service.create(any(CreateNotificationRequest.class))).thenReturn(stored());

    mockMvc
        .perform(
            post("/v1/notification-requests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "subject": "Disk almost full",
                      "body": "node-1 reached 91% disk usage",
                      "priority": "high",
                      "channels": ["console", "slack"],
                      "recipients": [{"channel": "slack", "address": "#ops-alerts"}],
                      "retry_policy": {"max_attempts": 3, "initial_backoff_seconds": 10}
                    }
                    """))
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", "/v1/notification-requests/" + ID))
        .andExpect(jsonPath("$.id").value(ID.toString()))
        .andExpect(jsonPath("$.resource_version").value(1))
        .andExpect(jsonPath("$.spec.priority").value("high"))
        .andExpect(jsonPath("$.spec.channels[1]").value("slack"))
        .andExpect(jsonPath("$.status.phase").value("Pending"));
  }

  @Test
  void createRejectsBlankSubject() throws Exception {
    mockMvc
        .perform(
            post("/v1/notification-requests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"subject": " ", "body": "b", "priority": "low", "channels": ["console"]}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("subject is required"));
    verifyNoInteractions(service);
  }

  @Test
  void createRejectsOutOfRangeRetryPolicy() throws Exception {
    mockMvc
        .perform(
            post("/v1/notification-requests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "subject": "s",
                      "body": "b",
                      "priority": "low",
                      "retry_policy": {"max_attempts": 0}
                    }
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    verifyNoInteractions(service);
  }

  @Test
  void createRejectsMissingBody() throws Exception {
    mockMvc
        .perform(post("/v1/notification-requests").contentType(MediaType.APPLICATION_JSON))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("request body is required"));
  }

  @Test
  void createReportsUnroutableRequest() throws Exception {
    when(service.create(any(CreateNotificationRequest.class)))
        .thenThrow(new InvalidNotificationRequestException("no channel matched the request"));

    mockMvc
        .perform(
            post("/v1/notification-requests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"subject": "s", "body": "b", "priority": "low"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_NOTIFICATION_REQUEST"))
        .andExpect(jsonPath("$.message").value("no channel matched the request"));
  }

  @Test
  void getReturns404WhenMissing() throws Exception {
    when(service.get(ID)).thenThrow(new NotificationRequestNotFoundException(ID));

    mockMvc
        .perform(get("/v1/notification-requests/" + ID))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_REQUEST_NOT_FOUND"));
  }

  @Test
  void getRejectsMalformedId() throws Exception {
    mockMvc
        .perform(get("/v1/notification-requests/not-a-uuid"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("id is invalid"));
  }

  @Test
  void listParsesPhase() throws Exception {
    when(service.list(eq(NotificationPhase.PARTIALLY_SENT), eq(20))).thenReturn(List.of(stored()));

    mockMvc
        .perform(get("/v1/notification-requests").param("phase", "PartiallySent").param("limit", "20"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items[0].id").value(ID.toString()))
        .andExpect(jsonPath("$.items[0].phase").value("Pending"));
    verify(service).list(NotificationPhase.PARTIALLY_SENT, 20);
  }

  @Test
  void listRejectsUnknownPhase() throws Exception {
    mockMvc
        .perform(get("/v1/notification-requests").param("phase", "Delivered"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("unknown phase: Delivered"));
  }

  @Test
  void echoesCorrelationIdHeader() throws Exception {
    when(service.get(ID)).thenReturn(stored());

    mockMvc
        .perform(get("/v1/notification-requests/" + ID).header("X-Correlation-Id", "corr-9"))
        .andExpect(status().isOk())
        .andExpect(header().string("X-Correlation-Id", "corr-9"));
  }

  private static NotificationRequest stored() {
    return new NotificationRequest(
        ID,
        Map.of("team", "ops"),
        new NotificationRequestSpec(
            "Disk almost full",
            "node-1 reached 91% disk usage",
            Priority.HIGH,
            List.of("console", "slack"),
            List.of(new Recipient("slack", "#ops-alerts")),
            null,
            "corr-1"),
        NotificationRequestStatus.pending(List.of()),
        1L,
        NOW,
        NOW);
  }
}
