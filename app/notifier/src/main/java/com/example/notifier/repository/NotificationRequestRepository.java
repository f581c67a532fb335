/*
 * Where: Notifier data access
 * What: Stores notification requests in notification_requests with jsonb spec/status
 * Why: Backs the status manager, the query API, resync and retention
 */
package com.example.notifier.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.notifier.model.NotificationPhase;
import com.example.notifier.model.NotificationRequest;
import com.example.notifier.model.NotificationRequestSpec;
import com.example.notifier.model.NotificationRequestStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRequestRepository implements NotificationRequestStore {

  private static final TypeReference<Map<String, String>> LABELS_TYPE = new TypeReference<>() {};
  private static final List<String> TERMINAL_PHASES =
      List.of(
          NotificationPhase.SENT.value(),
          NotificationPhase.PARTIALLY_SENT.value(),
          NotificationPhase.FAILED.value());
  private static final String SELECT_COLUMNS =
      """
      SELECT id, labels_json::text AS labels_json_text, spec_json::text AS spec_json_text,
             status_json::text AS status_json_text, resource_version, created_at, updated_at
      FROM notification_requests
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  @Override
  public void insert(NotificationRequest request) {
    final String sql =
        """
        INSERT INTO notification_requests (
          id,
          labels_json,
          spec_json,
          status_json,
          phase,
          resource_version,
          created_at,
          updated_at,
          completed_at
        ) VALUES (
          :id,
          :labelsJson::jsonb,
          :specJson::jsonb,
          :statusJson::jsonb,
          :phase,
          :resourceVersion,
          :createdAt,
          :updatedAt,
          :completedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", request.id())
            .addValue("labelsJson", write(request.labels()))
            .addValue("specJson", write(request.spec()))
            .addValue("statusJson", write(request.status()))
            .addValue("phase", request.status().phase().value())
            .addValue("resourceVersion", request.resourceVersion())
            .addValue("createdAt", toTimestamp(request.createdAt()))
            .addValue("updatedAt", toTimestamp(request.updatedAt()))
            .addValue("completedAt", toTimestamp(request.status().completionTime()));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public Optional<NotificationRequest> findById(UUID id) {
    final String sql = SELECT_COLUMNS + "WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public boolean compareAndSetStatus(
      UUID id, long expectedVersion, NotificationRequestStatus status, Instant updatedAt) {
    final String sql =
        """
        UPDATE notification_requests
        SET status_json = :statusJson::jsonb,
            phase = :phase,
            completed_at = :completedAt,
            resource_version = resource_version + 1,
            updated_at = :updatedAt
        WHERE id = :id
          AND resource_version = :expectedVersion
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("statusJson", write(status))
            .addValue("phase", status.phase().value())
            .addValue("completedAt", toTimestamp(status.completionTime()))
            .addValue("updatedAt", toTimestamp(updatedAt))
            .addValue("id", id)
            .addValue("expectedVersion", expectedVersion);
    return jdbcTemplate.update(sql, params) == 1;
  }

  public List<NotificationRequest> findByPhase(NotificationPhase phase, int limit) {
    final String sql = SELECT_COLUMNS + "WHERE phase = :phase ORDER BY created_at DESC LIMIT :limit";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("phase", phase.value()).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<NotificationRequest> findRecent(int limit) {
    final String sql = SELECT_COLUMNS + "ORDER BY created_at DESC LIMIT :limit";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Ids of requests still in flight, least recently touched first. */
  public List<UUID> findActiveIds(int limit) {
    final String sql =
        """
        SELECT id
        FROM notification_requests
        WHERE phase NOT IN (:terminalPhases)
        ORDER BY updated_at
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("terminalPhases", TERMINAL_PHASES)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> UUID.fromString(rs.getString("id")));
  }

  public int deleteCompletedBefore(Instant threshold) {
    final String sql =
        """
        DELETE FROM notification_requests
        WHERE completed_at < :threshold
          AND phase IN (:terminalPhases)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("threshold", toTimestamp(threshold))
            .addValue("terminalPhases", TERMINAL_PHASES);
    return jdbcTemplate.update(sql, params);
  }

  public int countStaleActive(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification_requests
        WHERE created_at < :threshold
          AND phase NOT IN (:terminalPhases)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("threshold", toTimestamp(threshold))
            .addValue("terminalPhases", TERMINAL_PHASES);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private NotificationRequest mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRequest(
        UUID.fromString(rs.getString("id")),
        read(rs.getString("labels_json_text"), LABELS_TYPE),
        read(rs.getString("spec_json_text"), NotificationRequestSpec.class),
        read(rs.getString("status_json_text"), NotificationRequestStatus.class),
        rs.getLong("resource_version"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }

  private String write(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize notification request column", ex);
    }
  }

  private <T> T read(String json, Class<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to deserialize notification request column", ex);
    }
  }

  private <T> T read(String json, TypeReference<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to deserialize notification request column", ex);
    }
  }
}
