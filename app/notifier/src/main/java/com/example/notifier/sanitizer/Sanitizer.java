/*
 * Where: Notifier sanitizer
 * What: Masks secrets in outbound text, falling back to coarse redaction when a pattern fails
 * Why: Unredacted content must never reach a channel, audit sink or log
 */
package com.example.notifier.sanitizer;

import com.google.common.annotations.VisibleForTesting;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class Sanitizer {

  private static final Logger logger = LoggerFactory.getLogger(Sanitizer.class);
  private static final List<String> SENSITIVE_KEYWORDS =
      List.of(
          "password", "passwd", "pwd", "secret", "token", "apikey", "api_key", "api-key",
          "bearer", "basic ", "credential", "private", "akia", "asia", "xox", "ghp_", "eyj",
          "://");
  private static final int OPAQUE_WORD_MIN_LENGTH = 24;

  private final List<SecretPattern> patterns;

  public Sanitizer() {
    this(SecretPatterns.defaults());
  }

  @VisibleForTesting
  Sanitizer(List<SecretPattern> patterns) {
    this.patterns = List.copyOf(patterns);
  }

  public SanitizationResult sanitize(String text) {
    if (text == null || text.isEmpty()) {
      return new SanitizationResult(text == null ? "" : text, false);
    }
    try {
      String redacted = text;
      for (SecretPattern pattern : patterns) {
        redacted = pattern.apply(redacted);
      }
      return new SanitizationResult(redacted, false);
    } catch (RuntimeException | StackOverflowError ex) {
      // Never return the raw text once a pattern has failed.
      logger.warn("sanitizer pattern pass failed; using coarse redaction", ex);
      return new SanitizationResult(coarseRedact(text), true);
    }
  }

  /**
   * Regex-free redaction: any line mentioning a credential keyword is replaced whole, and long
   * opaque words on other lines are masked.
   */
  @VisibleForTesting
  static String coarseRedact(String text) {
    final String[] lines = text.split("\n", -1);
    final StringBuilder out = new StringBuilder(text.length());
    for (int i = 0; i < lines.length; i++) {
      if (i > 0) {
        out.append('\n');
      }
      final String line = lines[i];
      if (mentionsSecret(line)) {
        out.append(SecretPatterns.MARKER);
      } else {
        out.append(maskOpaqueWords(line));
      }
    }
    return out.toString();
  }

  private static boolean mentionsSecret(String line) {
    final String lower = line.toLowerCase(Locale.ROOT);
    for (String keyword : SENSITIVE_KEYWORDS) {
      if (lower.contains(keyword)) {
        return true;
      }
    }
    return false;
  }

  private static String maskOpaqueWords(String line) {
    final StringBuilder out = new StringBuilder(line.length());
    int start = 0;
    while (start < line.length()) {
      int end = start;
      while (end < line.length() && !Character.isWhitespace(line.charAt(end))) {
        end++;
      }
      final String word = line.substring(start, end);
      out.append(looksOpaque(word) ? SecretPatterns.MARKER : word);
      while (end < line.length() && Character.isWhitespace(line.charAt(end))) {
        out.append(line.charAt(end));
        end++;
      }
      start = end;
    }
    return out.toString();
  }

  private static boolean looksOpaque(String word) {
    if (word.length() < OPAQUE_WORD_MIN_LENGTH) {
      return false;
    }
    boolean hasDigit = false;
    boolean hasLetter = false;
    for (int i = 0; i < word.length(); i++) {
      final char c = word.charAt(i);
      if (Character.isDigit(c)) {
        hasDigit = true;
      } else if (Character.isLetter(c)) {
        hasLetter = true;
      } else if ("+/=_-.".indexOf(c) < 0) {
        return false;
      }
    }
    return hasDigit && hasLetter;
  }
}
