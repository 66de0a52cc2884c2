/*
 * どこで: Delivery Queue サービス層
 * 何を: チャネル単位の送信結果を delivery_status へマージし、完了方針に従って sent/retry_scheduled/failed へ遷移させる
 * なぜ: 部分成功を保持したまま、失敗時はバックオフ付きで再送、上限到達で終端させるため
 */
package com.example.deliveryqueue.service;

import com.example.deliveryqueue.config.NotificationDeliveryProperties;
import com.example.deliveryqueue.model.ChannelDeliveryStatus;
import com.example.deliveryqueue.model.DeliveryChannels;
import com.example.deliveryqueue.model.NotificationRecord;
import com.example.deliveryqueue.model.NotificationStatus;
import com.example.deliveryqueue.repository.NotificationQueueRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class NotificationOutcomeService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationOutcomeService.class);

  private final NotificationQueueRepository repository;
  private final BackoffPolicy backoffPolicy;
  private final NotificationDeliveryProperties properties;
  private final NotificationMetrics metrics;
  private final Clock clock;

  /**
   * Records a successful send on one channel by the worker {@code reportedBy}.
   *
   * <p>The record becomes {@code sent} once the configured {@link ChannelCompletionPolicy} is
   * satisfied. Success never consumes an attempt. A success from a worker that no longer holds the
   * claim is kept in {@code delivery_status} but never moves the record.
   */
  @Transactional
  public NotificationRecord reportSuccess(
      UUID id, String channel, String providerMessageId, String reportedBy) {
    final Instant now = Instant.now(clock);
    final NotificationRecord record = lockReportable(id);
    final String normalized = requireRequestedChannel(record, channel);
    final ChannelDeliveryStatus entry = ChannelDeliveryStatus.sent(now, providerMessageId);

    repository.mergeChannelStatus(id, normalized, entry);
    if (DeliveryChannels.EMAIL.equals(normalized)) {
      repository.mirrorEmailSent(id, now, providerMessageId);
    }
    metrics.recordChannelResult(normalized, ChannelDeliveryStatus.SENT);

    if (record.status() != NotificationStatus.PROCESSING || !holdsClaim(record, reportedBy)) {
      logger.info(
          "late channel success merged id={} channel={} status={} reportedBy={} claimedBy={}",
          id,
          normalized,
          record.status().dbValue(),
          reportedBy,
          record.claimedBy());
      return reload(id);
    }
    final NotificationRecord merged = record.withChannelStatus(normalized, entry);
    if (properties.completionPolicy().isDelivered(merged)) {
      completeDelivery(merged, now);
    }
    return reload(id);
  }

  /**
   * Records a failed send on one channel by the worker {@code reportedBy} and, when the completion
   * policy allows a decision, schedules a retry or fails the notification.
   *
   * @throws InvalidNotificationTransitionException when another worker holds the current claim
   */
  @Transactional
  public NotificationRecord reportFailure(
      UUID id, String channel, String errorMessage, String reportedBy) {
    final Instant now = Instant.now(clock);
    final NotificationRecord record = lockReportable(id);
    final String normalized = requireRequestedChannel(record, channel);
    // 失効した claim からの失敗を現在の claim の結果として数えない
    if (record.status() == NotificationStatus.PROCESSING && !holdsClaim(record, reportedBy)) {
      throw new InvalidNotificationTransitionException(
          "notification is claimed by another worker: id="
              + id
              + " claimedBy="
              + record.claimedBy()
              + " reportedBy="
              + reportedBy);
    }
    final String error = ErrorMessages.truncate(errorMessage, properties.errorMessageMaxLength());
    final ChannelDeliveryStatus entry = ChannelDeliveryStatus.failed(now, error);

    repository.mergeChannelStatus(id, normalized, entry);
    if (DeliveryChannels.EMAIL.equals(normalized)) {
      repository.mirrorEmailFailure(id, error);
    }
    metrics.recordChannelResult(normalized, ChannelDeliveryStatus.FAILED);

    if (record.status() != NotificationStatus.PROCESSING) {
      logger.info(
          "late channel failure merged id={} channel={} status={}",
          id,
          normalized,
          record.status().dbValue());
      return reload(id);
    }
    final NotificationRecord merged = record.withChannelStatus(normalized, entry);
    final ChannelCompletionPolicy policy = properties.completionPolicy();
    if (!policy.isFailureFinal(merged)) {
      logger.info("channel failure recorded, waiting for other channels id={} channel={}", id, normalized);
      return reload(id);
    }
    if (policy.isDelivered(merged)) {
      completeDelivery(merged, now);
    } else {
      recordFailedAttempt(merged, error, now);
    }
    return reload(id);
  }

  /** Completes a claimed record whose channels were already delivered in the current episode. */
  @Transactional
  public NotificationRecord completeIfDelivered(UUID id) {
    final NotificationRecord record =
        repository.findByIdForUpdate(id).orElseThrow(() -> new NotificationNotFoundException(id));
    if (record.status() == NotificationStatus.PROCESSING
        && properties.completionPolicy().isDelivered(record)) {
      completeDelivery(record, Instant.now(clock));
    }
    return reload(id);
  }

  /**
   * Applies one failed attempt to a processing record that the caller holds a row lock on.
   * Also used by {@link LeaseSweeper} for expired leases.
   */
  public void recordFailedAttempt(NotificationRecord record, String error, Instant now) {
    final int nextAttempts = record.attempts() + 1;
    if (nextAttempts < record.maxAttempts()) {
      final Duration backoff = backoffPolicy.backoffFor(record.attempts());
      final Instant nextAttemptAt = now.plus(backoff);
      if (repository.markRetryScheduled(record.id(), nextAttempts, nextAttemptAt, error) == 0) {
        logger.warn("notification left processing before retry could be scheduled id={}", record.id());
        return;
      }
      metrics.recordOutcome(NotificationStatus.RETRY_SCHEDULED.dbValue());
      logger.warn(
          "notification retry scheduled id={} attempts={} nextAttemptAt={} error={}",
          record.id(),
          nextAttempts,
          nextAttemptAt,
          error);
      return;
    }
    if (repository.markFailed(record.id(), nextAttempts, error) == 0) {
      logger.warn("notification left processing before failure could be recorded id={}", record.id());
      return;
    }
    metrics.recordOutcome(NotificationStatus.FAILED.dbValue());
    logger.error(
        "notification failed id={} attempts={} maxAttempts={} error={}",
        record.id(),
        nextAttempts,
        record.maxAttempts(),
        error);
  }

  private void completeDelivery(NotificationRecord record, Instant now) {
    if (repository.markSent(record.id(), now, record.reminderEpisode()) == 0) {
      logger.warn("notification left processing before completion id={}", record.id());
      return;
    }
    metrics.recordOutcome(NotificationStatus.SENT.dbValue());
    logger.info(
        "notification sent id={} channels={} reminder={}",
        record.id(),
        record.deliveryMethods(),
        record.reminderEpisode());
  }

  // processing 中、または claim 後に状態が進んだレコードのみ結果を受け付ける
  private NotificationRecord lockReportable(UUID id) {
    final NotificationRecord record =
        repository.findByIdForUpdate(id).orElseThrow(() -> new NotificationNotFoundException(id));
    if (record.status() == NotificationStatus.PROCESSING) {
      return record;
    }
    if (record.claimedAt() != null && NotificationStateMachine.POST_CLAIM.contains(record.status())) {
      return record;
    }
    throw new InvalidNotificationTransitionException(
        "notification is not claimed: id=" + id + " status=" + record.status().dbValue());
  }

  private static boolean holdsClaim(NotificationRecord record, String reportedBy) {
    return reportedBy != null && reportedBy.equals(record.claimedBy());
  }

  private String requireRequestedChannel(NotificationRecord record, String channel) {
    final String normalized = DeliveryChannels.normalize(channel);
    if (!record.deliveryMethods().contains(normalized)) {
      throw new IllegalArgumentException("channel not requested for notification: " + normalized);
    }
    return normalized;
  }

  private NotificationRecord reload(UUID id) {
    return repository.findById(id).orElseThrow(() -> new NotificationNotFoundException(id));
  }
}
