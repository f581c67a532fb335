package com.example.notifier.sanitizer;

/**
 * @param degraded true when the pattern pass failed and the coarse line-level redaction was used
 */
public record SanitizationResult(String text, boolean degraded) {}
