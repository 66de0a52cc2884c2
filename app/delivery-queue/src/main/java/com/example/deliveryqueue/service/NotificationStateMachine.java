/*
 * どこで: Delivery Queue サービス層
 * 何を: 通知状態の正当な遷移と送信可能条件を定義する
 * なぜ: SQL の条件付き更新と同じ規則をコード上でも一箇所で検証できるようにするため
 */
package com.example.deliveryqueue.service;

import static com.example.deliveryqueue.model.NotificationStatus.CANCELLED;
import static com.example.deliveryqueue.model.NotificationStatus.FAILED;
import static com.example.deliveryqueue.model.NotificationStatus.PAUSED;
import static com.example.deliveryqueue.model.NotificationStatus.PENDING;
import static com.example.deliveryqueue.model.NotificationStatus.PROCESSING;
import static com.example.deliveryqueue.model.NotificationStatus.REMINDER_DUE;
import static com.example.deliveryqueue.model.NotificationStatus.RETRY_SCHEDULED;
import static com.example.deliveryqueue.model.NotificationStatus.SENT;

import com.example.deliveryqueue.model.NotificationRecord;
import com.example.deliveryqueue.model.NotificationStatus;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public final class NotificationStateMachine {

  /** Statuses a worker may claim from. */
  public static final Set<NotificationStatus> CLAIMABLE =
      Collections.unmodifiableSet(EnumSet.of(PENDING, RETRY_SCHEDULED, REMINDER_DUE));

  public static final Set<NotificationStatus> CANCELLABLE =
      Collections.unmodifiableSet(EnumSet.of(PENDING, RETRY_SCHEDULED, REMINDER_DUE, PAUSED, PROCESSING));

  public static final Set<NotificationStatus> FORCE_RETRYABLE =
      Collections.unmodifiableSet(
          EnumSet.of(PENDING, RETRY_SCHEDULED, REMINDER_DUE, FAILED, CANCELLED, PAUSED));

  public static final Set<NotificationStatus> TRIGGERABLE =
      Collections.unmodifiableSet(EnumSet.of(PENDING, RETRY_SCHEDULED, FAILED));

  public static final Set<NotificationStatus> PAUSABLE =
      Collections.unmodifiableSet(EnumSet.of(PENDING, RETRY_SCHEDULED, REMINDER_DUE));

  // claim 後に状態が進んだレコード。遅れて届いたチャネル結果はマージのみ行う
  public static final Set<NotificationStatus> POST_CLAIM =
      Collections.unmodifiableSet(EnumSet.of(RETRY_SCHEDULED, FAILED, SENT, CANCELLED));

  private static final Map<NotificationStatus, Set<NotificationStatus>> TRANSITIONS =
      new EnumMap<>(NotificationStatus.class);

  static {
    // PENDING への遷移は enqueue/forceRetry/resume による管理操作
    TRANSITIONS.put(PENDING, EnumSet.of(PROCESSING, CANCELLED, PAUSED, PENDING));
    TRANSITIONS.put(RETRY_SCHEDULED, EnumSet.of(PROCESSING, CANCELLED, PAUSED, PENDING));
    TRANSITIONS.put(REMINDER_DUE, EnumSet.of(PROCESSING, CANCELLED, PAUSED, PENDING));
    TRANSITIONS.put(PROCESSING, EnumSet.of(SENT, RETRY_SCHEDULED, FAILED, CANCELLED));
    TRANSITIONS.put(SENT, EnumSet.of(REMINDER_DUE, PENDING));
    TRANSITIONS.put(FAILED, EnumSet.of(PENDING));
    TRANSITIONS.put(CANCELLED, EnumSet.of(PENDING));
    TRANSITIONS.put(PAUSED, EnumSet.of(PENDING, CANCELLED));
  }

  private NotificationStateMachine() {}

  public static boolean canTransition(NotificationStatus from, NotificationStatus to) {
    return TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
  }

  public static void requireTransition(NotificationStatus from, NotificationStatus to) {
    if (!canTransition(from, to)) {
      throw new InvalidNotificationTransitionException(
          "notification cannot move from " + from.dbValue() + " to " + to.dbValue());
    }
  }

  /** Eligibility for picking: status, send_after, soft expiry and attempt budget. */
  public static boolean isEligible(NotificationRecord record, Instant now) {
    if (!CLAIMABLE.contains(record.status())) {
      return false;
    }
    if (record.sendAfter() == null || record.sendAfter().isAfter(now)) {
      return false;
    }
    if (isExpired(record, now)) {
      return false;
    }
    return record.attempts() < record.maxAttempts();
  }

  public static boolean isExpired(NotificationRecord record, Instant now) {
    return record.expiresAt() != null && !record.expiresAt().isAfter(now);
  }
}
