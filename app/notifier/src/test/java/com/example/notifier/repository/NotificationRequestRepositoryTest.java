/*
 * Where: Notifier repository integration tests
 * What: Compare-and-set status writes, jsonb round trips and threshold queries on Postgres
 * Why: Version checks and phase filters must hold in the real SQL dialect
 */
package com.example.notifier.repository;

import com.example.notifier.AbstractPostgresContainerTest;
import com.example.notifier.model.AttemptOutcome;
import com.example.notifier.model.DeliveryAttempt;
import com.example.notifier.model.NotificationPhase;
import com.example.notifier.model.NotificationRequest;
import com.example.notifier.model.NotificationRequestSpec;
import com.example.notifier.model.NotificationRequestStatus;
import com.example.notifier.model.Priority;
import com.example.notifier.model.Recipient;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class NotificationRequestRepositoryTest extends AbstractPostgresContainerTest {

    private static final Instant BASE_TIME = Instant.parse("2026-01-17T00:00:00Z");
    private static final Duration GAP = Duration.ofHours(1);

    @Autowired
    private NotificationRequestRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanup() {
        jdbcTemplate.update("DELETE FROM notification_requests", new MapSqlParameterSource());
    }

    @Test
    void insertedRequestRoundTripsThroughJsonb() {
        NotificationRequest request = pending(BASE_TIME);
        repository.insert(request);

        NotificationRequest loaded = repository.findById(request.id()).orElseThrow();

        assertThat(loaded.labels()).containsEntry("team", "ops");
        assertThat(loaded.spec()).isEqualTo(request.spec());
        assertThat(loaded.status().phase()).isEqualTo(NotificationPhase.PENDING);
        assertThat(loaded.resourceVersion()).isEqualTo(1L);
        assertThat(loaded.createdAt()).isEqualTo(BASE_TIME);
    }

    @Test
    void compareAndSetBumpsVersionOnlyForExpectedVersion() {
        NotificationRequest request = pending(BASE_TIME);
        repository.insert(request);
        NotificationRequestStatus sending = request.status().withAttempt(sentAttempt());

        boolean first = repository.compareAndSetStatus(request.id(), 1L, sending, BASE_TIME.plus(GAP));
        // a second writer still holding version 1 loses
        boolean stale = repository.compareAndSetStatus(request.id(), 1L, request.status(), BASE_TIME.plus(GAP));

        assertThat(first).isTrue();
        assertThat(stale).isFalse();
        NotificationRequest loaded = repository.findById(request.id()).orElseThrow();
        assertThat(loaded.resourceVersion()).isEqualTo(2L);
        assertThat(loaded.status().deliveryAttempts()).hasSize(1);
        assertThat(loaded.status().deliveryAttempts().get(0).channel()).isEqualTo("console");
        assertThat(loaded.updatedAt()).isEqualTo(BASE_TIME.plus(GAP));
    }

    @Test
    void compareAndSetReturnsFalseForMissingRequest() {
        assertThat(repository.compareAndSetStatus(
                UUID.randomUUID(), 1L, NotificationRequestStatus.pending(List.of()), BASE_TIME))
                .isFalse();
    }

    @Test
    void activeIdsExcludeTerminalRequests() {
        NotificationRequest active = pending(BASE_TIME);
        NotificationRequest done = pending(BASE_TIME);
        repository.insert(active);
        repository.insert(done);
        repository.compareAndSetStatus(done.id(), 1L, terminal(BASE_TIME), BASE_TIME.plus(GAP));

        assertThat(repository.findActiveIds(10)).containsExactly(active.id());
        assertThat(repository.findByPhase(NotificationPhase.SENT, 10))
                .extracting(NotificationRequest::id)
                .containsExactly(done.id());
        assertThat(repository.findRecent(10)).hasSize(2);
    }

    @Test
    void deleteCompletedBeforeKeepsRecentAndActiveRequests() {
        NotificationRequest old = pending(BASE_TIME);
        NotificationRequest recent = pending(BASE_TIME);
        NotificationRequest active = pending(BASE_TIME);
        repository.insert(old);
        repository.insert(recent);
        repository.insert(active);
        repository.compareAndSetStatus(old.id(), 1L, terminal(BASE_TIME), BASE_TIME);
        repository.compareAndSetStatus(
                recent.id(), 1L, terminal(BASE_TIME.plus(GAP.multipliedBy(3))), BASE_TIME);

        int deleted = repository.deleteCompletedBefore(BASE_TIME.plus(GAP));

        assertThat(deleted).isEqualTo(1);
        assertThat(repository.findById(old.id())).isEmpty();
        assertThat(repository.findById(recent.id())).isPresent();
        assertThat(repository.findById(active.id())).isPresent();
        assertThat(repository.countStaleActive(BASE_TIME.plus(GAP))).isEqualTo(1);
    }

    private static NotificationRequest pending(Instant createdAt) {
        NotificationRequestSpec spec = new NotificationRequestSpec(
                "Disk almost full",
                "node-1 reached 91% disk usage",
                Priority.HIGH,
                List.of("console", "slack"),
                List.of(new Recipient("slack", "#ops-alerts")),
                null,
                "corr-1");
        return new NotificationRequest(
                UUID.randomUUID(),
                Map.of("team", "ops"),
                spec,
                NotificationRequestStatus.pending(List.of()),
                1L,
                createdAt,
                createdAt);
    }

    private static DeliveryAttempt sentAttempt() {
        return new DeliveryAttempt(
                "console", 1, BASE_TIME, AttemptOutcome.SUCCESS, null, null, 12L, false, null);
    }

    private static NotificationRequestStatus terminal(Instant completedAt) {
        return new NotificationRequestStatus(
                NotificationPhase.SENT, List.of(), 0, 0, 0, List.of(), "AllChannelsSent", null, completedAt);
    }
}
