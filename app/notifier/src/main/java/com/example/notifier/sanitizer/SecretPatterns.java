/*
 * Where: Notifier sanitizer
 * What: Catalog of credential shapes masked before content leaves the controller
 * Why: Subjects and bodies are free text and routinely carry pasted secrets
 */
package com.example.notifier.sanitizer;

import java.util.List;

public final class SecretPatterns {

  public static final String MARKER = "***REDACTED***";

  // key=value style: group 1 key, group 2 separator, group 3 opening quote; the closing quote stays.
  private static final String ASSIGNMENT_VALUE = "([\"']?\\s*[:=]\\s*)([\"']?)[^\\s\"',;&}]+";
  private static final String KEEP_ASSIGNMENT = "$1$2$3" + MARKER;

  private static final List<SecretPattern> DEFAULTS =
      List.of(
          SecretPattern.of(
              "password", "(?i)\\b(password|passwd|pwd)\\b" + ASSIGNMENT_VALUE, KEEP_ASSIGNMENT),
          SecretPattern.of(
              "api-key", "(?i)\\b(api[_-]?key|x-api-key)\\b" + ASSIGNMENT_VALUE, KEEP_ASSIGNMENT),
          SecretPattern.of(
              "secret",
              "(?i)\\b(secret|client[_-]?secret|secret[_-]?key)\\b" + ASSIGNMENT_VALUE,
              KEEP_ASSIGNMENT),
          SecretPattern.of(
              "token",
              "(?i)\\b(token|access[_-]?token|refresh[_-]?token|auth[_-]?token|id[_-]?token)\\b"
                  + ASSIGNMENT_VALUE,
              KEEP_ASSIGNMENT),
          SecretPattern.of(
              "credential",
              "(?i)\\b(credentials?|private[_-]?key)\\b" + ASSIGNMENT_VALUE,
              KEEP_ASSIGNMENT),
          SecretPattern.of(
              "aws-secret-key",
              "(?i)\\b(aws_secret_access_key|aws_secret)\\b" + ASSIGNMENT_VALUE,
              KEEP_ASSIGNMENT),
          SecretPattern.of("bearer", "(?i)\\b(bearer\\s+)[A-Za-z0-9\\-._~+/]+=*", "$1" + MARKER),
          SecretPattern.of("basic-auth", "(?i)\\b(basic\\s+)[A-Za-z0-9+/]{8,}=*", "$1" + MARKER),
          SecretPattern.of("aws-access-key-id", "\\b(?:AKIA|ASIA)[0-9A-Z]{16}\\b", MARKER),
          SecretPattern.of("github-token", "\\bgh[pousr]_[A-Za-z0-9]{36,}\\b", MARKER),
          SecretPattern.of("slack-token", "\\bxox[abprs]-[A-Za-z0-9-]{10,}", MARKER),
          SecretPattern.of(
              "slack-webhook", "https://hooks\\.slack\\.com/services/[A-Za-z0-9/_-]+", MARKER),
          SecretPattern.of(
              "jwt", "\\beyJ[A-Za-z0-9_-]+\\.eyJ[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+", MARKER),
          SecretPattern.of(
              "pem-private-key",
              "-----BEGIN (?:[A-Z ]+ )?PRIVATE KEY-----[\\s\\S]*?-----END (?:[A-Z ]+ )?PRIVATE KEY-----",
              MARKER),
          SecretPattern.of(
              "connection-string",
              "(?i)\\b((?:postgres(?:ql)?|mysql|mongodb(?:\\+srv)?|redis|rediss|amqps?)://)"
                  + "[^:/\\s@]+:[^@\\s]+@",
              "$1" + MARKER + "@"),
          SecretPattern.of(
              "url-userinfo", "(?i)\\b(https?://)[^:/\\s@]+:[^@\\s]+@", "$1" + MARKER + "@"),
          SecretPattern.of("google-api-key", "\\bAIza[0-9A-Za-z_-]{35}", MARKER),
          SecretPattern.of("stripe-key", "\\b(?:sk|rk)_(?:live|test)_[0-9A-Za-z]{16,}", MARKER),
          SecretPattern.of(
              "sendgrid-key", "\\bSG\\.[A-Za-z0-9_-]{22}\\.[A-Za-z0-9_-]{43}", MARKER),
          SecretPattern.of("azure-account-key", "(?i)\\b(AccountKey=)[^;\\s]+", "$1" + MARKER));

  private SecretPatterns() {}

  public static List<SecretPattern> defaults() {
    return DEFAULTS;
  }
}
