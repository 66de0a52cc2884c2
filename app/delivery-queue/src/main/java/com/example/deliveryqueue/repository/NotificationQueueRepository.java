/*
 * どこで: Delivery Queue データアクセス
 * 何を: notification_queue の条件付き更新/範囲取得/チャネル結果マージを担う
 * なぜ: status 列をロックとして使う claim を含め、全状態遷移を単一 SQL の条件付き書き込みにするため
 */
package com.example.deliveryqueue.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.deliveryqueue.model.ChannelDeliveryStatus;
import com.example.deliveryqueue.model.EnqueueCommand;
import com.example.deliveryqueue.model.NotificationRecord;
import com.example.deliveryqueue.model.NotificationStatus;
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
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationQueueRepository {

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
  private static final TypeReference<Map<String, ChannelDeliveryStatus>> DELIVERY_STATUS_MAP =
      new TypeReference<>() {};

  private static final String COLUMNS =
      """
      id, status, delivery_methods::text AS delivery_methods_json,
      delivery_status::text AS delivery_status_json, attempts, max_attempts, next_attempt_at,
      send_after, expires_at, template, template_data::text AS template_data_json, custom_message,
      metadata::text AS metadata_json, reminder_schedule::text AS reminder_schedule_json,
      reminder_count, last_reminder_at, reminder_template, reminder_episode, episode_started_at,
      last_error, triggered_by, triggered_at, completed_at, claimed_by, claimed_at, lease_until,
      email_sent, email_sent_at, email_message_id, email_attempts, last_email_error, created_at
      """;

  // 送信可能条件: 状態・送信開始時刻・有効期限・試行上限をすべて満たすこと
  private static final String ELIGIBLE_PREDICATE =
      """
      status IN ('pending', 'retry_scheduled', 'reminder_due')
        AND send_after <= :now
        AND (expires_at IS NULL OR expires_at > :now)
        AND attempts < max_attempts
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  /** Creates the row or resets an existing one to a fresh pending episode, unless it is in flight. */
  public Optional<NotificationRecord> upsertPending(
      EnqueueCommand command, int maxAttempts, Instant sendAfter, Instant now) {
    final String sql =
        """
        INSERT INTO notification_queue (
          id, status, delivery_methods, delivery_status, attempts, max_attempts, next_attempt_at,
          send_after, expires_at, template, template_data, custom_message, metadata, last_error,
          triggered_by, triggered_at, episode_started_at, reminder_episode, created_at
        ) VALUES (
          :id, 'pending', :deliveryMethods::jsonb, '{}'::jsonb, 0, :maxAttempts, NULL,
          :sendAfter, :expiresAt, :template, :templateData::jsonb, :customMessage, :metadata::jsonb, NULL,
          :triggeredBy, :now, :now, FALSE, :now
        )
        ON CONFLICT (id) DO UPDATE SET
          status = 'pending',
          delivery_methods = EXCLUDED.delivery_methods,
          delivery_status = '{}'::jsonb,
          attempts = 0,
          max_attempts = EXCLUDED.max_attempts,
          next_attempt_at = NULL,
          send_after = EXCLUDED.send_after,
          expires_at = EXCLUDED.expires_at,
          template = EXCLUDED.template,
          template_data = EXCLUDED.template_data,
          custom_message = EXCLUDED.custom_message,
          metadata = EXCLUDED.metadata,
          last_error = NULL,
          triggered_by = EXCLUDED.triggered_by,
          triggered_at = EXCLUDED.triggered_at,
          episode_started_at = EXCLUDED.episode_started_at,
          reminder_episode = FALSE,
          reminder_count = 0,
          completed_at = NULL,
          lease_until = NULL
        WHERE notification_queue.status <> 'processing'
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", command.id())
            .addValue("deliveryMethods", toJson(command.deliveryMethods()))
            .addValue("maxAttempts", maxAttempts)
            .addValue("sendAfter", toTimestamp(sendAfter))
            .addValue("expiresAt", toTimestamp(command.expiresAt()))
            .addValue("template", command.template())
            .addValue("templateData", jsonOrEmptyObject(command.templateDataJson()))
            .addValue("customMessage", command.customMessage())
            .addValue("metadata", jsonOrEmptyObject(command.metadataJson()))
            .addValue("triggeredBy", command.triggeredBy())
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<NotificationRecord> findById(UUID id) {
    final String sql = "SELECT " + COLUMNS + " FROM notification_queue WHERE id = :id";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("id", id), this::mapRow)
        .stream()
        .findFirst();
  }

  // 呼び出し側のトランザクション内で行ロックを取る
  public Optional<NotificationRecord> findByIdForUpdate(UUID id) {
    final String sql = "SELECT " + COLUMNS + " FROM notification_queue WHERE id = :id FOR UPDATE";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("id", id), this::mapRow)
        .stream()
        .findFirst();
  }

  public List<NotificationRecord> findEligible(Instant now, int limit) {
    // 再送 > リマインダー > 新規 の優先度で、同一優先度内は作成順 (FIFO)
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM notification_queue WHERE "
            + ELIGIBLE_PREDICATE
            + """
            ORDER BY
              CASE status
                WHEN 'retry_scheduled' THEN 1
                WHEN 'reminder_due' THEN 2
                ELSE 3
              END,
              created_at ASC,
              id ASC
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countEligible(Instant now) {
    final String sql = "SELECT COUNT(*) FROM notification_queue WHERE " + ELIGIBLE_PREDICATE;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("now", toTimestamp(now)), Integer.class);
    return count == null ? 0 : count;
  }

  /**
   * Compare-and-swap on status: moves an eligible row to processing in one conditional UPDATE.
   * An empty result means another worker won the claim or the row is no longer eligible.
   */
  public Optional<NotificationRecord> claim(
      UUID id, Instant now, Instant leaseUntil, String claimedBy) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'processing',
            triggered_at = :now,
            claimed_by = :claimedBy,
            claimed_at = :now,
            lease_until = :leaseUntil
        WHERE id = :id
          AND
        """
            + ELIGIBLE_PREDICATE
            + " RETURNING "
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("now", toTimestamp(now))
            .addValue("claimedBy", claimedBy)
            .addValue("leaseUntil", toTimestamp(leaseUntil));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  // jsonb の || は同一キーのみ上書きし、他チャネルの結果は残す
  public int mergeChannelStatus(UUID id, String channel, ChannelDeliveryStatus entry) {
    final String sql =
        """
        UPDATE notification_queue
        SET delivery_status = delivery_status || jsonb_build_object(CAST(:channel AS text), CAST(:entry AS jsonb))
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("channel", channel)
            .addValue("entry", toJson(entry));
    return jdbcTemplate.update(sql, params);
  }

  public int mirrorEmailSent(UUID id, Instant sentAt, String messageId) {
    final String sql =
        """
        UPDATE notification_queue
        SET email_sent = TRUE,
            email_sent_at = :sentAt,
            email_message_id = :messageId
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("messageId", messageId);
    return jdbcTemplate.update(sql, params);
  }

  public int mirrorEmailFailure(UUID id, String error) {
    final String sql =
        """
        UPDATE notification_queue
        SET email_attempts = email_attempts + 1,
            last_email_error = :error
        WHERE id = :id
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("id", id).addValue("error", error));
  }

  public int markSent(UUID id, Instant completedAt, boolean reminderCompleted) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'sent',
            completed_at = :completedAt,
            last_error = NULL,
            next_attempt_at = NULL,
            lease_until = NULL,
            reminder_count = CASE
              WHEN :reminderCompleted THEN LEAST(reminder_count + 1, jsonb_array_length(reminder_schedule))
              ELSE reminder_count
            END,
            last_reminder_at = CASE WHEN :reminderCompleted THEN :completedAt ELSE last_reminder_at END,
            reminder_episode = FALSE
        WHERE id = :id
          AND status = 'processing'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("completedAt", toTimestamp(completedAt))
            .addValue("reminderCompleted", reminderCompleted);
    return jdbcTemplate.update(sql, params);
  }

  public int markRetryScheduled(UUID id, int attempts, Instant nextAttemptAt, String lastError) {
    // send_after も揃えて進め、送信可能条件だけでバックオフを効かせる
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'retry_scheduled',
            attempts = :attempts,
            next_attempt_at = :nextAttemptAt,
            send_after = :nextAttemptAt,
            last_error = :lastError,
            lease_until = NULL
        WHERE id = :id
          AND status = 'processing'
          AND :attempts <= max_attempts
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("attempts", attempts)
            .addValue("nextAttemptAt", toTimestamp(nextAttemptAt))
            .addValue("lastError", lastError);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailed(UUID id, int attempts, String lastError) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'failed',
            attempts = LEAST(:attempts, max_attempts),
            next_attempt_at = NULL,
            last_error = :lastError,
            lease_until = NULL
        WHERE id = :id
          AND status = 'processing'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("attempts", attempts)
            .addValue("lastError", lastError);
    return jdbcTemplate.update(sql, params);
  }

  // スイーパー用: リース切れの PROCESSING を他のスイーパーと競合しないようロックして取得する
  public List<NotificationRecord> lockExpiredLeases(Instant now, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
             FROM notification_queue
            WHERE status = 'processing'
              AND (lease_until IS NULL OR lease_until <= :now)
            ORDER BY lease_until NULLS FIRST
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<NotificationRecord> cancel(UUID id, String reason, Instant now) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'cancelled',
            last_error = :reason,
            completed_at = :now,
            next_attempt_at = NULL,
            lease_until = NULL
        WHERE id = :id
          AND status IN ('pending', 'retry_scheduled', 'reminder_due', 'paused', 'processing')
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("reason", reason)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<NotificationRecord> forceRetry(
      UUID id, Instant sendAfter, boolean clearExpiry, String triggeredBy, Instant now) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'pending',
            attempts = 0,
            send_after = :sendAfter,
            next_attempt_at = NULL,
            last_error = NULL,
            expires_at = CASE WHEN :clearExpiry THEN NULL ELSE expires_at END,
            triggered_by = :triggeredBy,
            triggered_at = :now,
            completed_at = NULL,
            lease_until = NULL
        WHERE id = :id
          AND status IN ('pending', 'retry_scheduled', 'reminder_due', 'failed', 'cancelled', 'paused')
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("sendAfter", toTimestamp(sendAfter))
            .addValue("clearExpiry", clearExpiry)
            .addValue("triggeredBy", triggeredBy)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * Makes one queued or failed record eligible now. Without {@code resetAttempts} the attempt count
   * and last error are kept, so only a record with budget left can be triggered that way.
   */
  public Optional<NotificationRecord> trigger(
      UUID id, boolean resetAttempts, String triggeredBy, Instant now) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'pending',
            send_after = :now,
            next_attempt_at = NULL,
            attempts = CASE WHEN :resetAttempts THEN 0 ELSE attempts END,
            last_error = CASE WHEN :resetAttempts THEN NULL ELSE last_error END,
            triggered_by = :triggeredBy,
            triggered_at = :now,
            lease_until = NULL
        WHERE id = :id
          AND status IN ('pending', 'retry_scheduled', 'failed')
          AND (:resetAttempts OR attempts < max_attempts)
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("resetAttempts", resetAttempts)
            .addValue("triggeredBy", triggeredBy)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<NotificationRecord> pause(UUID id) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'paused'
        WHERE id = :id
          AND status IN ('pending', 'retry_scheduled', 'reminder_due')
        RETURNING
        """
            + COLUMNS;
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("id", id), this::mapRow)
        .stream()
        .findFirst();
  }

  public Optional<NotificationRecord> resume(UUID id, Instant now) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'pending',
            send_after = :now,
            next_attempt_at = NULL
        WHERE id = :id
          AND status = 'paused'
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", id).addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  // リマインダー配信中に張り直すと完了時の reminder_count 加算で新スケジュールの先頭が飛ぶため対象外にする
  public Optional<NotificationRecord> scheduleReminders(
      UUID id, List<String> reminderSchedule, String reminderTemplate) {
    final String sql =
        """
        UPDATE notification_queue
        SET reminder_schedule = :reminderSchedule::jsonb,
            reminder_count = 0,
            reminder_template = :reminderTemplate
        WHERE id = :id
          AND reminder_episode = FALSE
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("reminderSchedule", toJson(reminderSchedule))
            .addValue("reminderTemplate", reminderTemplate);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int advanceScheduledSendAfter(Instant now) {
    final String sql =
        """
        UPDATE notification_queue
        SET send_after = :now,
            next_attempt_at = CASE WHEN status = 'retry_scheduled' THEN :now ELSE next_attempt_at END
        WHERE status IN ('pending', 'retry_scheduled')
          AND send_after > :now
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("now", toTimestamp(now)));
  }

  // (completed_at, id) のキーセットでページングし、未到来の候補が先頭を塞いでも後続を走査できるようにする
  public List<NotificationRecord> findReminderCandidates(
      Instant now, Instant afterCompletedAt, UUID afterId, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
             FROM notification_queue
            WHERE status = 'sent'
              AND completed_at IS NOT NULL
              AND reminder_count < jsonb_array_length(reminder_schedule)
              AND (expires_at IS NULL OR expires_at > :now)
              AND (CAST(:afterCompletedAt AS timestamptz) IS NULL
                   OR (completed_at, id) > (CAST(:afterCompletedAt AS timestamptz), CAST(:afterId AS uuid)))
            ORDER BY completed_at ASC, id ASC
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("afterCompletedAt", toTimestamp(afterCompletedAt))
            .addValue("afterId", afterId)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  // reminder_count を条件に含め、同じオフセットで二重に再オープンしない。
  // リマインダーは新しい配信エピソードなので試行回数も 0 から数え直す
  public int promoteToReminderDue(UUID id, int expectedReminderCount, Instant now) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'reminder_due',
            attempts = 0,
            send_after = :now,
            next_attempt_at = NULL,
            last_error = NULL,
            reminder_episode = TRUE,
            episode_started_at = :now,
            triggered_by = 'auto_reminder',
            triggered_at = :now
        WHERE id = :id
          AND status = 'sent'
          AND reminder_count = :expectedReminderCount
          AND reminder_count < jsonb_array_length(reminder_schedule)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("expectedReminderCount", expectedReminderCount)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return NotificationRecord.builder()
        .id(UUID.fromString(rs.getString("id")))
        .status(NotificationStatus.fromDbValue(rs.getString("status")))
        .deliveryMethods(readJson(rs.getString("delivery_methods_json"), STRING_LIST))
        .deliveryStatus(readJson(rs.getString("delivery_status_json"), DELIVERY_STATUS_MAP))
        .attempts(rs.getInt("attempts"))
        .maxAttempts(rs.getInt("max_attempts"))
        .nextAttemptAt(getInstant(rs, "next_attempt_at"))
        .sendAfter(getInstant(rs, "send_after"))
        .expiresAt(getInstant(rs, "expires_at"))
        .template(rs.getString("template"))
        .templateDataJson(rs.getString("template_data_json"))
        .customMessage(rs.getString("custom_message"))
        .metadataJson(rs.getString("metadata_json"))
        .reminderSchedule(readJson(rs.getString("reminder_schedule_json"), STRING_LIST))
        .reminderCount(rs.getInt("reminder_count"))
        .lastReminderAt(getInstant(rs, "last_reminder_at"))
        .reminderTemplate(rs.getString("reminder_template"))
        .reminderEpisode(rs.getBoolean("reminder_episode"))
        .episodeStartedAt(getInstant(rs, "episode_started_at"))
        .lastError(rs.getString("last_error"))
        .triggeredBy(rs.getString("triggered_by"))
        .triggeredAt(getInstant(rs, "triggered_at"))
        .completedAt(getInstant(rs, "completed_at"))
        .claimedBy(rs.getString("claimed_by"))
        .claimedAt(getInstant(rs, "claimed_at"))
        .leaseUntil(getInstant(rs, "lease_until"))
        .emailSent(rs.getBoolean("email_sent"))
        .emailSentAt(getInstant(rs, "email_sent_at"))
        .emailMessageId(rs.getString("email_message_id"))
        .emailAttempts(rs.getInt("email_attempts"))
        .lastEmailError(rs.getString("last_email_error"))
        .createdAt(getInstant(rs, "created_at"))
        .build();
  }

  private <T> T readJson(String json, TypeReference<T> type) {
    if (json == null) {
      return null;
    }
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new DataRetrievalFailureException("notification_queue jsonb column parse failure", ex);
    }
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("notification_queue jsonb serialization failure", ex);
    }
  }

  private String jsonOrEmptyObject(String json) {
    return json == null || json.isBlank() ? "{}" : json;
  }
}
