/*
 * Where: Shared utilities
 * What: Resolves the correlation id carried by a request, or mints a new one
 * Why: Deliveries, audit events and logs of one request must share a single id
 */
package com.example.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class CorrelationIds {

  public static final String MDC_KEY = "correlation_id";
  public static final String HEADER = "X-Correlation-Id";

  private CorrelationIds() {}

  public static String newCorrelationId() {
    return UUID.randomUUID().toString();
  }

  /**
   * Returns the explicit id when present, then the id bound to the current MDC, and finally a
   * freshly generated one.
   */
  public static String resolve(String explicit) {
    if (explicit != null && !explicit.isBlank()) {
      return explicit.trim();
    }
    final String fromMdc = MDC.get(MDC_KEY);
    if (fromMdc != null && !fromMdc.isBlank()) {
      return fromMdc;
    }
    return newCorrelationId();
  }
}
