/*
 * Where: Shared utilities
 * What: Converts between Instant and JDBC Timestamp explicitly
 * Why: The PostgreSQL driver cannot infer a SQL type for a bare Instant
 */
package com.example.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant is always UTC; Timestamp.from keeps it that way regardless of the session zone.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
