/*
 * どこで: Delivery Queue サービス層
 * 何を: enqueue/cancel/forceRetry/pause/resume/リマインダー設定/個別・一括トリガー/統計の管理操作を提供する
 * なぜ: 管理 API と NATS イベントから同じ検証と状態遷移規則でキューを操作するため
 */
package com.example.deliveryqueue.service;

import com.example.deliveryqueue.config.NotificationDeliveryProperties;
import com.example.deliveryqueue.config.NotificationReminderProperties;
import com.example.deliveryqueue.config.NotificationStatsProperties;
import com.example.deliveryqueue.model.DeliveryChannels;
import com.example.deliveryqueue.model.EnqueueCommand;
import com.example.deliveryqueue.model.NotificationRecord;
import com.example.deliveryqueue.model.NotificationStats;
import com.example.deliveryqueue.model.NotificationStatus;
import com.example.deliveryqueue.repository.NotificationQueueRepository;
import com.example.deliveryqueue.repository.NotificationStatsRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class NotificationAdminService {

  static final String DEFAULT_CANCEL_REASON = "Cancelled by admin";
  static final String DEFAULT_TRIGGERED_BY = "system";
  static final String ADMIN_TRIGGERED_BY = "admin";

  private static final Logger logger = LoggerFactory.getLogger(NotificationAdminService.class);

  private final NotificationQueueRepository repository;
  private final NotificationStatsRepository statsRepository;
  private final NotificationDeliveryProperties deliveryProperties;
  private final NotificationReminderProperties reminderProperties;
  private final NotificationStatsProperties statsProperties;
  private final Clock clock;

  /** Creates or resets the notification as pending; rejected while it is being processed. */
  @Transactional
  public NotificationRecord enqueue(EnqueueCommand command) {
    final EnqueueCommand normalized = validate(command);
    final Instant now = Instant.now(clock);
    final int maxAttempts =
        normalized.maxAttempts() == null
            ? deliveryProperties.defaultMaxAttempts()
            : normalized.maxAttempts();
    final Instant sendAfter = now.plus(normalized.delay());
    final NotificationRecord record =
        repository
            .upsertPending(normalized, maxAttempts, sendAfter, now)
            .orElseThrow(
                () ->
                    new InvalidNotificationTransitionException(
                        "notification is processing and cannot be enqueued: id=" + command.id()));
    logger.info(
        "notification enqueued id={} template={} channels={} sendAfter={} triggeredBy={}",
        record.id(),
        record.template(),
        record.deliveryMethods(),
        record.sendAfter(),
        record.triggeredBy());
    return record;
  }

  @Transactional
  public NotificationRecord cancel(UUID id, String reason) {
    final String effectiveReason = reason == null || reason.isBlank() ? DEFAULT_CANCEL_REASON : reason;
    final NotificationRecord record =
        repository
            .cancel(id, effectiveReason, Instant.now(clock))
            .orElseThrow(() -> rejected(id, NotificationStatus.CANCELLED));
    logger.info("notification cancelled id={} reason={}", id, effectiveReason);
    return record;
  }

  /** Resets the attempt budget and makes the record eligible at {@code sendAfter} (now if null). */
  @Transactional
  public NotificationRecord forceRetry(UUID id, Instant sendAfter, boolean clearExpiry) {
    final Instant now = Instant.now(clock);
    final Instant effectiveSendAfter = sendAfter == null ? now : sendAfter;
    final NotificationRecord record =
        repository
            .forceRetry(id, effectiveSendAfter, clearExpiry, ADMIN_TRIGGERED_BY, now)
            .orElseThrow(() -> rejected(id, NotificationStatus.PENDING));
    if (record.expiresAt() != null && !record.expiresAt().isAfter(effectiveSendAfter)) {
      logger.warn("force-retried notification is already expired id={} expiresAt={}", id, record.expiresAt());
    }
    logger.info("notification force-retried id={} sendAfter={}", id, effectiveSendAfter);
    return record;
  }

  @Transactional
  public NotificationRecord pause(UUID id) {
    final NotificationRecord record =
        repository.pause(id).orElseThrow(() -> rejected(id, NotificationStatus.PAUSED));
    logger.info("notification paused id={}", id);
    return record;
  }

  @Transactional
  public NotificationRecord resume(UUID id) {
    final NotificationRecord record =
        repository
            .resume(id, Instant.now(clock))
            .orElseThrow(
                () -> {
                  final NotificationRecord current = get(id);
                  return new InvalidNotificationTransitionException(
                      "notification is not paused: id=" + id + " status=" + current.status().dbValue());
                });
    logger.info("notification resumed id={}", id);
    return record;
  }

  /** Arms reminders as {@code "+N days"} offsets; defaults come from {@code notification.reminder}. */
  @Transactional
  public NotificationRecord scheduleReminders(UUID id, String reminderTemplate, List<Integer> days) {
    final List<Integer> effectiveDays =
        days == null || days.isEmpty() ? reminderProperties.defaultDays() : days;
    final List<String> schedule = effectiveDays.stream().map(ReminderOffsets::ofDays).toList();
    final String template =
        reminderTemplate == null || reminderTemplate.isBlank()
            ? reminderProperties.defaultTemplate()
            : reminderTemplate;
    final NotificationRecord record =
        repository
            .scheduleReminders(id, schedule, template)
            .orElseThrow(
                () -> {
                  get(id);
                  return new InvalidNotificationTransitionException(
                      "reminders cannot be rescheduled during a reminder delivery: id=" + id);
                });
    logger.info("reminders scheduled id={} template={} schedule={}", id, template, schedule);
    return record;
  }

  /**
   * Sends one pending, retry_scheduled or failed notification now. Unless {@code resetAttempts} is
   * set the attempt count and last error are kept, which requires attempts left in the budget.
   */
  @Transactional
  public NotificationRecord trigger(UUID id, boolean resetAttempts) {
    final NotificationRecord record =
        repository
            .trigger(id, resetAttempts, ADMIN_TRIGGERED_BY, Instant.now(clock))
            .orElseThrow(() -> triggerRejected(id));
    logger.info(
        "notification triggered id={} resetAttempts={} attempts={}",
        id,
        resetAttempts,
        record.attempts());
    return record;
  }

  @Transactional
  public int triggerAllPending() {
    final int affected = repository.advanceScheduledSendAfter(Instant.now(clock));
    logger.info("pending notifications triggered count={}", affected);
    return affected;
  }

  public NotificationRecord get(UUID id) {
    return repository.findById(id).orElseThrow(() -> new NotificationNotFoundException(id));
  }

  public NotificationStats stats(Integer recentFailuresLimit) {
    final int limit =
        recentFailuresLimit == null ? statsProperties.recentFailuresLimit() : recentFailuresLimit;
    if (limit <= 0) {
      throw new IllegalArgumentException("recent_failures must be positive");
    }
    final Map<String, Long> byStatus = statsRepository.countByStatus();
    final long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
    return new NotificationStats(
        total,
        byStatus,
        byStatus.getOrDefault(NotificationStatus.PENDING.dbValue(), 0L),
        byStatus.getOrDefault(NotificationStatus.FAILED.dbValue(), 0L),
        byStatus.getOrDefault(NotificationStatus.RETRY_SCHEDULED.dbValue(), 0L),
        statsRepository.averageAttempts(),
        statsRepository.countByDeliveryMethod(),
        statsRepository.findRecentFailures(limit),
        Instant.now(clock));
  }

  private EnqueueCommand validate(EnqueueCommand command) {
    if (command == null || command.id() == null) {
      throw new IllegalArgumentException("notification id is required");
    }
    if (command.template() == null || command.template().isBlank()) {
      throw new IllegalArgumentException("template is required");
    }
    final List<String> channels = DeliveryChannels.normalizeAll(command.deliveryMethods());
    if (channels.size() != command.deliveryMethods().size()) {
      throw new IllegalArgumentException("delivery_methods must not contain duplicates");
    }
    final Duration delay = command.delay() == null ? Duration.ZERO : command.delay();
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must not be negative");
    }
    if (command.maxAttempts() != null && command.maxAttempts() <= 0) {
      throw new IllegalArgumentException("max_attempts must be positive");
    }
    final String triggeredBy =
        command.triggeredBy() == null || command.triggeredBy().isBlank()
            ? DEFAULT_TRIGGERED_BY
            : command.triggeredBy();
    return new EnqueueCommand(
        command.id(),
        command.template().trim(),
        channels,
        command.templateDataJson(),
        delay,
        triggeredBy,
        command.maxAttempts(),
        command.expiresAt(),
        command.customMessage(),
        command.metadataJson());
  }

  private RuntimeException triggerRejected(UUID id) {
    final NotificationRecord current = get(id);
    if (NotificationStateMachine.TRIGGERABLE.contains(current.status())) {
      return new InvalidNotificationTransitionException(
          "notification has no attempts left, trigger with reset_attempts: id=" + id);
    }
    return rejected(id, NotificationStatus.PENDING);
  }

  // 条件付き UPDATE が 0 件のとき: 未検出なら 404、状態が合わなければ 409
  private RuntimeException rejected(UUID id, NotificationStatus target) {
    final NotificationRecord current = get(id);
    return new InvalidNotificationTransitionException(
        "notification cannot move from "
            + current.status().dbValue()
            + " to "
            + target.dbValue()
            + ": id="
            + id);
  }
}
