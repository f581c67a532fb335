/*
 * Where: Notifier audit
 * What: Posts audit batches to the audit service
 * Why: The audit service owns durable storage and retention of compliance records
 */
package com.example.notifier.audit;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

public class HttpAuditSink implements AuditSink {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring component and cannot be copied defensively")
  private final RestClient restClient;

  private final String path;

  public HttpAuditSink(RestClient restClient, String path) {
    this.restClient = restClient;
    this.path = path;
  }

  @Override
  public void writeBatch(List<AuditEvent> events) {
    if (events.isEmpty()) {
      return;
    }
    try {
      restClient
          .post()
          .uri(path)
          .contentType(MediaType.APPLICATION_JSON)
          .body(new AuditBatch(events))
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw new AuditSinkException(
          "audit sink responded with http status " + ex.getStatusCode().value(), ex);
    } catch (RestClientException ex) {
      throw new AuditSinkException("audit sink unreachable", ex);
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record AuditBatch(List<AuditEvent> events) {}
}
