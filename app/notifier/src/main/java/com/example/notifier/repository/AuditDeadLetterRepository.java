/*
 * Where: Notifier data access
 * What: Stores audit events that could not be delivered to the audit sink
 * Why: Compliance events survive a sink outage and are replayed once it recovers
 */
package com.example.notifier.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AuditDeadLetterRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insertAll(List<AuditDeadLetter> deadLetters) {
    if (deadLetters.isEmpty()) {
      return;
    }
    final String sql =
        """
        INSERT INTO audit_dead_letters (
          id,
          event_id,
          event_json,
          error_message,
          attempt_count,
          created_at,
          last_attempt_at
        ) VALUES (
          :id,
          :eventId,
          :eventJson::jsonb,
          :errorMessage,
          :attemptCount,
          :createdAt,
          :lastAttemptAt
        )
        """;
    final SqlParameterSource[] batch =
        deadLetters.stream()
            .map(
                deadLetter ->
                    new MapSqlParameterSource()
                        .addValue("id", deadLetter.id())
                        .addValue("eventId", deadLetter.eventId())
                        .addValue("eventJson", deadLetter.eventJson())
                        .addValue("errorMessage", deadLetter.errorMessage())
                        .addValue("attemptCount", deadLetter.attemptCount())
                        .addValue("createdAt", toTimestamp(deadLetter.createdAt()))
                        .addValue("lastAttemptAt", toTimestamp(deadLetter.lastAttemptAt())))
            .toArray(SqlParameterSource[]::new);
    jdbcTemplate.batchUpdate(sql, batch);
  }

  public List<AuditDeadLetter> findOldest(int limit) {
    final String sql =
        """
        SELECT id, event_id, event_json::text AS event_json_text, error_message, attempt_count,
               created_at, last_attempt_at
        FROM audit_dead_letters
        ORDER BY created_at
        LIMIT :limit
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new AuditDeadLetter(
                UUID.fromString(rs.getString("id")),
                UUID.fromString(rs.getString("event_id")),
                rs.getString("event_json_text"),
                rs.getString("error_message"),
                rs.getInt("attempt_count"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("last_attempt_at"))));
  }

  public int deleteByIds(List<UUID> ids) {
    if (ids.isEmpty()) {
      return 0;
    }
    final String sql = "DELETE FROM audit_dead_letters WHERE id IN (:ids)";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("ids", ids));
  }

  public int markAttempted(List<UUID> ids, String errorMessage, Instant attemptedAt) {
    if (ids.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        UPDATE audit_dead_letters
        SET attempt_count = attempt_count + 1,
            error_message = :errorMessage,
            last_attempt_at = :attemptedAt
        WHERE id IN (:ids)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("errorMessage", errorMessage)
            .addValue("attemptedAt", toTimestamp(attemptedAt))
            .addValue("ids", ids);
    return jdbcTemplate.update(sql, params);
  }

  public int deleteOlderThan(Instant threshold) {
    final String sql = "DELETE FROM audit_dead_letters WHERE created_at < :threshold";
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold)));
  }
}
