package com.example.notifier.repository;

import java.time.Instant;
import java.util.UUID;

public record AuditDeadLetter(
    UUID id,
    UUID eventId,
    String eventJson,
    String errorMessage,
    int attemptCount,
    Instant createdAt,
    Instant lastAttemptAt) {}
