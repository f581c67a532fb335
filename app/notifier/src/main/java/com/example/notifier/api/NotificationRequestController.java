/*
 * Where: Notifier API
 * What: Create, inspect and list notification requests
 * Why: Clients declare what to deliver and observe status; delivery itself happens asynchronously
 */
package com.example.notifier.api;

import com.example.notifier.api.request.CreateNotificationRequest;
import com.example.notifier.api.response.NotificationRequestResponse;
import com.example.notifier.api.response.NotificationRequestSummary;
import com.example.notifier.api.response.NotificationRequestsResponse;
import com.example.notifier.model.NotificationPhase;
import com.example.notifier.model.NotificationRequest;
import com.example.notifier.service.NotificationRequestService;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/notification-requests")
@RequiredArgsConstructor
public class NotificationRequestController {

  private final NotificationRequestService service;

  @PostMapping
  public ResponseEntity<NotificationRequestResponse> create(
      @Valid @RequestBody CreateNotificationRequest request) {
    final NotificationRequest created = service.create(request);
    return ResponseEntity.created(URI.create("/v1/notification-requests/" + created.id()))
        .body(NotificationRequestResponse.from(created));
  }

  @GetMapping("/{id}")
  public NotificationRequestResponse get(@PathVariable("id") UUID id) {
    return NotificationRequestResponse.from(service.get(id));
  }

  @GetMapping
  public NotificationRequestsResponse list(
      @RequestParam(name = "phase", required = false) String phase,
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    final NotificationPhase parsedPhase = phase == null ? null : NotificationPhase.fromValue(phase);
    return new NotificationRequestsResponse(
        service.list(parsedPhase, limit).stream().map(NotificationRequestSummary::from).toList());
  }
}
