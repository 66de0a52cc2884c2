/*
 * どこで: NotificationStatsRepository の統合テスト
 * 何を: ステータス別件数、平均試行回数、チャネル利用数、直近失敗一覧の SQL 集計を検証する
 * なぜ: stats() が JSONB 展開や丸めを含む集計を DB 側で正しく行うことを確認するため
 */
package com.example.deliveryqueue.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import com.example.deliveryqueue.AbstractPostgresContainerTest;
import com.example.deliveryqueue.model.EnqueueCommand;
import com.example.deliveryqueue.model.NotificationStats.RecentFailure;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationStatsRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE = Instant.parse("2026-03-01T09:00:00Z");

  @Autowired private NotificationStatsRepository statsRepository;
  @Autowired private NotificationQueueRepository queueRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM notification_queue", new MapSqlParameterSource());
  }

  @Test
  void emptyQueueAggregatesToZero() {
    assertThat(statsRepository.countByStatus()).isEmpty();
    assertThat(statsRepository.averageAttempts()).isEqualByComparingTo("0");
    assertThat(statsRepository.countByDeliveryMethod()).isEmpty();
    assertThat(statsRepository.findRecentFailures(10)).isEmpty();
  }

  @Test
  void countsStatusesAndChannels() {
    enqueue(List.of("email"));
    enqueue(List.of("email", "sms"));
    final UUID failed = enqueue(List.of("push"));
    fail(failed, 3, "bounce", BASE);

    assertThat(statsRepository.countByStatus()).containsOnly(
        entry("failed", 1L),
        entry("pending", 2L));
    assertThat(statsRepository.countByDeliveryMethod())
        .containsEntry("email", 2L)
        .containsEntry("sms", 1L)
        .containsEntry("push", 1L);
  }

  @Test
  void averageAttemptsIsRoundedToTwoDecimals() {
    enqueue(List.of("email"));
    enqueue(List.of("email"));
    fail(enqueue(List.of("email")), 2, "bounce", BASE);

    // 2 / 3 = 0.666...
    assertThat(statsRepository.averageAttempts()).isEqualByComparingTo("0.67");
  }

  @Test
  void recentFailuresAreNewestFirstAndLimited() {
    final UUID oldest = enqueue(List.of("email"));
    final UUID middle = enqueue(List.of("email"));
    final UUID newest = enqueue(List.of("email"));
    fail(oldest, 3, "old", BASE);
    fail(middle, 3, "mid", BASE.plus(Duration.ofHours(1)));
    fail(newest, 1, "new", BASE.plus(Duration.ofHours(2)));
    enqueue(List.of("email"));

    final List<RecentFailure> failures = statsRepository.findRecentFailures(2);

    assertThat(failures).extracting(RecentFailure::id).containsExactly(newest, middle);
    assertThat(failures.get(0).error()).isEqualTo("new");
    assertThat(failures.get(0).attempts()).isEqualTo(1);
    assertThat(failures.get(0).createdAt()).isEqualTo(BASE);
  }

  private UUID enqueue(List<String> channels) {
    final UUID id = UUID.randomUUID();
    final EnqueueCommand command =
        new EnqueueCommand(
            id, "invitation_approved", channels, "{}", Duration.ZERO, "system", null, null, null, null);
    queueRepository.upsertPending(command, 3, BASE, BASE).orElseThrow();
    return id;
  }

  private void fail(UUID id, int attempts, String error, Instant triggeredAt) {
    jdbcTemplate.update(
        """
        UPDATE notification_queue
        SET status = 'failed', attempts = :attempts, last_error = :error, triggered_at = :triggeredAt
        WHERE id = :id
        """,
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("attempts", attempts)
            .addValue("error", error)
            .addValue("triggeredAt", Timestamp.from(triggeredAt)));
  }
}
