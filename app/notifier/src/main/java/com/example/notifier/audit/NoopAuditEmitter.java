package com.example.notifier.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Used when notifier.audit.enabled=false. */
public class NoopAuditEmitter implements AuditEmitter {

  private static final Logger logger = LoggerFactory.getLogger(NoopAuditEmitter.class);

  @Override
  public void emit(AuditEvent event) {
    logger.debug("audit disabled; dropping event type={} id={}", event.eventType(), event.eventId());
  }
}
