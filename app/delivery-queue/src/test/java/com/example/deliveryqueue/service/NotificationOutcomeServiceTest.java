/*
 * どこで: NotificationOutcomeService のユニットテスト
 * 何を: チャネル結果のマージ、部分成功、バックオフ付き再送、試行上限での失敗確定を検証する
 * なぜ: 状態遷移と attempts の増減が配信結果ごとに正しく決まることを保証するため
 */
package com.example.deliveryqueue.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.deliveryqueue.NotificationFixtures;
import com.example.deliveryqueue.config.NotificationBackoffProperties;
import com.example.deliveryqueue.config.NotificationDeliveryProperties;
import com.example.deliveryqueue.model.ChannelDeliveryStatus;
import com.example.deliveryqueue.model.NotificationRecord;
import com.example.deliveryqueue.model.NotificationStatus;
import com.example.deliveryqueue.repository.NotificationQueueRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationOutcomeServiceTest {

  private static final Instant CLAIMED_AT = Instant.parse("2026-03-01T09:00:00Z");
  private static final Instant NOW = CLAIMED_AT.plusSeconds(5);
  private static final UUID ID = UUID.fromString("11111111-1111-1111-1111-111111111111");
  private static final NotificationBackoffProperties BACKOFF =
      new NotificationBackoffProperties(
          List.of(
              Duration.ofMinutes(5), Duration.ofMinutes(30), Duration.ofHours(2), Duration.ofHours(6)));

  @Mock private NotificationQueueRepository repository;
  @Mock private NotificationMetrics metrics;

  @Test
  void failureBeforeBudgetSchedulesRetryWithFirstBackoff() {
    // 1 回目の失敗: retry_scheduled / attempts=1 / next_attempt_at = now + 5m
    final NotificationOutcomeService service = service(ChannelCompletionPolicy.ALL_CHANNELS, 500);
    final NotificationRecord record = NotificationFixtures.processing(ID, List.of("email"), 0, CLAIMED_AT);
    stubLocked(record);
    when(repository.markRetryScheduled(ID, 1, NOW.plus(Duration.ofMinutes(5)), "smtp timeout"))
        .thenReturn(1);

    service.reportFailure(ID, "email", "smtp timeout", "worker-1");

    verify(repository).mergeChannelStatus(ID, "email", ChannelDeliveryStatus.failed(NOW, "smtp timeout"));
    verify(repository).mirrorEmailFailure(ID, "smtp timeout");
    verify(repository).markRetryScheduled(ID, 1, NOW.plus(Duration.ofMinutes(5)), "smtp timeout");
    verify(repository, never()).markFailed(any(), anyInt(), anyString());
    verify(metrics).recordOutcome("retry_scheduled");
  }

  @Test
  void secondFailureUsesSecondBackoffStep() {
    final NotificationOutcomeService service = service(ChannelCompletionPolicy.ALL_CHANNELS, 500);
    final NotificationRecord record = NotificationFixtures.processing(ID, List.of("email"), 1, CLAIMED_AT);
    stubLocked(record);
    when(repository.markRetryScheduled(ID, 2, NOW.plus(Duration.ofMinutes(30)), "smtp timeout"))
        .thenReturn(1);

    service.reportFailure(ID, "email", "smtp timeout", "worker-1");

    verify(repository).markRetryScheduled(ID, 2, NOW.plus(Duration.ofMinutes(30)), "smtp timeout");
  }

  @Test
  void failureOnLastAttemptFailsPermanently() {
    // attempts=2, max=3 の失敗は failed / attempts=3
    final NotificationOutcomeService service = service(ChannelCompletionPolicy.ALL_CHANNELS, 500);
    final NotificationRecord record = NotificationFixtures.processing(ID, List.of("email"), 2, CLAIMED_AT);
    stubLocked(record);
    when(repository.markFailed(ID, 3, "bounce")).thenReturn(1);

    service.reportFailure(ID, "email", "bounce", "worker-1");

    verify(repository).markFailed(ID, 3, "bounce");
    verify(repository, never()).markRetryScheduled(any(), anyInt(), any(), anyString());
    verify(metrics).recordOutcome("failed");
  }

  @Test
  void allChannelsKeepsProcessingUntilEveryChannelSucceeded() {
    final NotificationOutcomeService service = service(ChannelCompletionPolicy.ALL_CHANNELS, 500);
    final NotificationRecord record =
        NotificationFixtures.processing(ID, List.of("email", "sms"), 0, CLAIMED_AT);
    stubLocked(record);

    service.reportSuccess(ID, "email", "m1", "worker-1");

    verify(repository).mergeChannelStatus(ID, "email", ChannelDeliveryStatus.sent(NOW, "m1"));
    verify(repository).mirrorEmailSent(ID, NOW, "m1");
    verify(repository, never()).markSent(any(), any(), anyBoolean());
  }

  @Test
  void allChannelsMarksSentOnLastOutstandingSuccess() {
    final NotificationOutcomeService service = service(ChannelCompletionPolicy.ALL_CHANNELS, 500);
    final NotificationRecord record =
        NotificationFixtures.withSent(
            NotificationFixtures.processing(ID, List.of("email", "sms"), 0, CLAIMED_AT), "email", NOW);
    stubLocked(record);
    when(repository.markSent(ID, NOW, false)).thenReturn(1);

    service.reportSuccess(ID, "sms", "s1", "worker-1");

    verify(repository).markSent(ID, NOW, false);
    verify(repository, never()).mirrorEmailSent(any(), any(), any());
    verify(metrics).recordOutcome("sent");
  }

  @Test
  void allChannelsSchedulesRetryOnPartialFailureAndKeepsEmailResult() {
    // email 成功後に sms 失敗: retry_scheduled で email の成功結果は残る
    final NotificationOutcomeService service = service(ChannelCompletionPolicy.ALL_CHANNELS, 500);
    final NotificationRecord record =
        NotificationFixtures.withSent(
            NotificationFixtures.processing(ID, List.of("email", "sms"), 0, CLAIMED_AT), "email", NOW);
    stubLocked(record);
    when(repository.markRetryScheduled(ID, 1, NOW.plus(Duration.ofMinutes(5)), "invalid number"))
        .thenReturn(1);

    service.reportFailure(ID, "sms", "invalid number", "worker-1");

    verify(repository).mergeChannelStatus(ID, "sms", ChannelDeliveryStatus.failed(NOW, "invalid number"));
    verify(repository).markRetryScheduled(ID, 1, NOW.plus(Duration.ofMinutes(5)), "invalid number");
    verify(repository, never()).mergeChannelStatus(eq(ID), eq("email"), any());
  }

  @Test
  void anyChannelMarksSentOnFirstSuccess() {
    final NotificationOutcomeService service = service(ChannelCompletionPolicy.ANY_CHANNEL, 500);
    final NotificationRecord record =
        NotificationFixtures.processing(ID, List.of("email", "sms"), 0, CLAIMED_AT);
    stubLocked(record);
    when(repository.markSent(ID, NOW, false)).thenReturn(1);

    service.reportSuccess(ID, "email", "m1", "worker-1");

    verify(repository).markSent(ID, NOW, false);
  }

  @Test
  void anyChannelDefersFailureWhileOtherChannelsAreUnreported() {
    final NotificationOutcomeService service = service(ChannelCompletionPolicy.ANY_CHANNEL, 500);
    final NotificationRecord record =
        NotificationFixtures.processing(ID, List.of("email", "sms"), 0, CLAIMED_AT);
    stubLocked(record);

    service.reportFailure(ID, "sms", "invalid number", "worker-1");

    verify(repository).mergeChannelStatus(ID, "sms", ChannelDeliveryStatus.failed(NOW, "invalid number"));
    verify(repository, never()).markRetryScheduled(any(), anyInt(), any(), anyString());
    verify(repository, never()).markFailed(any(), anyInt(), anyString());
  }

  @Test
  void anyChannelSchedulesRetryWhenEveryChannelFailed() {
    final NotificationOutcomeService service = service(ChannelCompletionPolicy.ANY_CHANNEL, 500);
    final NotificationRecord record =
        NotificationFixtures.withFailed(
            NotificationFixtures.processing(ID, List.of("email", "sms"), 0, CLAIMED_AT), "sms", NOW);
    stubLocked(record);
    when(repository.markRetryScheduled(ID, 1, NOW.plus(Duration.ofMinutes(5)), "smtp timeout"))
        .thenReturn(1);

    service.reportFailure(ID, "email", "smtp timeout", "worker-1");

    verify(repository).markRetryScheduled(ID, 1, NOW.plus(Duration.ofMinutes(5)), "smtp timeout");
  }

  @Test
  void anyChannelCompletesOnFailureWhenAnotherChannelAlreadySucceeded() {
    final NotificationOutcomeService service = service(ChannelCompletionPolicy.ANY_CHANNEL, 500);
    final NotificationRecord record =
        NotificationFixtures.withSent(
            NotificationFixtures.processing(ID, List.of("email", "sms"), 0, CLAIMED_AT), "email", NOW);
    stubLocked(record);
    when(repository.markSent(ID, NOW, false)).thenReturn(1);

    service.reportFailure(ID, "sms", "invalid number", "worker-1");

    verify(repository).markSent(ID, NOW, false);
    verify(repository, never()).markRetryScheduled(any(), anyInt(), any(), anyString());
  }

  @Test
  void reminderEpisodeCompletionAdvancesReminderCount() {
    final NotificationOutcomeService service = service(ChannelCompletionPolicy.ALL_CHANNELS, 500);
    final NotificationRecord record =
        NotificationFixtures.processing(ID, List.of("email"), 0, CLAIMED_AT).toBuilder()
            .reminderEpisode(true)
            .reminderSchedule(List.of("+3 days", "+7 days"))
            .build();
    stubLocked(record);
    when(repository.markSent(ID, NOW, true)).thenReturn(1);

    service.reportSuccess(ID, "email", "m1", "worker-1");

    verify(repository).markSent(ID, NOW, true);
  }

  @Test
  void lateReportOnCancelledRecordOnlyMergesChannelData() {
    final NotificationOutcomeService service = service(ChannelCompletionPolicy.ALL_CHANNELS, 500);
    final NotificationRecord record =
        NotificationFixtures.processing(ID, List.of("email"), 0, CLAIMED_AT).toBuilder()
            .status(NotificationStatus.CANCELLED)
            .build();
    stubLocked(record);

    service.reportSuccess(ID, "email", "m1", "worker-1");

    verify(repository).mergeChannelStatus(ID, "email", ChannelDeliveryStatus.sent(NOW, "m1"));
    verify(repository, never()).markSent(any(), any(), anyBoolean());
  }

  @Test
  void reportOnNeverClaimedRecordIsRejected() {
    final NotificationOutcomeService service = service(ChannelCompletionPolicy.ALL_CHANNELS, 500);
    final NotificationRecord record = NotificationFixtures.pending(ID, CLAIMED_AT).build();
    when(repository.findByIdForUpdate(ID)).thenReturn(Optional.of(record));

    assertThatThrownBy(() -> service.reportSuccess(ID, "email", "m1", "worker-1"))
        .isInstanceOf(InvalidNotificationTransitionException.class)
        .hasMessageContaining("status=pending");
    verify(repository, never()).mergeChannelStatus(any(), anyString(), any());
  }

  @Test
  void reportForUnrequestedChannelIsRejected() {
    final NotificationOutcomeService service = service(ChannelCompletionPolicy.ALL_CHANNELS, 500);
    when(repository.findByIdForUpdate(ID))
        .thenReturn(Optional.of(NotificationFixtures.processing(ID, List.of("email"), 0, CLAIMED_AT)));

    assertThatThrownBy(() -> service.reportFailure(ID, "sms", "boom", "worker-1"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("channel not requested for notification: sms");
  }

  @Test
  void unknownNotificationIsNotFound() {
    final NotificationOutcomeService service = service(ChannelCompletionPolicy.ALL_CHANNELS, 500);
    when(repository.findByIdForUpdate(ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.reportSuccess(ID, "email", null, "worker-1"))
        .isInstanceOf(NotificationNotFoundException.class);
  }

  @Test
  void failureFromWorkerWithoutClaimIsRejected() {
    // lease 失効後に別ワーカーが再 claim したレコードへの古い失敗報告
    final NotificationOutcomeService service = service(ChannelCompletionPolicy.ALL_CHANNELS, 500);
    final NotificationRecord record =
        NotificationFixtures.processing(ID, List.of("email"), 1, CLAIMED_AT).toBuilder()
            .claimedBy("worker-2")
            .build();
    when(repository.findByIdForUpdate(ID)).thenReturn(Optional.of(record));

    assertThatThrownBy(() -> service.reportFailure(ID, "email", "smtp timeout", "worker-1"))
        .isInstanceOf(InvalidNotificationTransitionException.class)
        .hasMessageContaining("claimedBy=worker-2")
        .hasMessageContaining("reportedBy=worker-1");
    verify(repository, never()).mergeChannelStatus(any(), anyString(), any());
    verify(repository, never()).markRetryScheduled(any(), anyInt(), any(), anyString());
    verify(repository, never()).markFailed(any(), anyInt(), anyString());
  }

  @Test
  void successFromWorkerWithoutClaimIsOnlyMerged() {
    final NotificationOutcomeService service = service(ChannelCompletionPolicy.ALL_CHANNELS, 500);
    final NotificationRecord record =
        NotificationFixtures.processing(ID, List.of("email"), 1, CLAIMED_AT).toBuilder()
            .claimedBy("worker-2")
            .build();
    stubLocked(record);

    service.reportSuccess(ID, "email", "m1", "worker-1");

    verify(repository).mergeChannelStatus(ID, "email", ChannelDeliveryStatus.sent(NOW, "m1"));
    verify(repository, never()).markSent(any(), any(), anyBoolean());
  }

  @Test
  void storedErrorIsTruncated() {
    final NotificationOutcomeService service = service(ChannelCompletionPolicy.ALL_CHANNELS, 10);
    final NotificationRecord record = NotificationFixtures.processing(ID, List.of("sms"), 0, CLAIMED_AT);
    stubLocked(record);
    when(repository.markRetryScheduled(eq(ID), eq(1), any(), eq("0123456789"))).thenReturn(1);

    service.reportFailure(ID, "SMS", "0123456789-overflow", "worker-1");

    final ArgumentCaptor<ChannelDeliveryStatus> entry = ArgumentCaptor.forClass(ChannelDeliveryStatus.class);
    verify(repository).mergeChannelStatus(eq(ID), eq("sms"), entry.capture());
    assertThat(entry.getValue().error()).isEqualTo("0123456789");
  }

  private NotificationOutcomeService service(ChannelCompletionPolicy policy, int errorMaxLength) {
    final NotificationDeliveryProperties properties =
        new NotificationDeliveryProperties(
            true,
            Duration.ofSeconds(5),
            50,
            3,
            Duration.ofMinutes(15),
            Duration.ofMinutes(1),
            Duration.ofSeconds(30),
            4,
            errorMaxLength,
            policy);
    return new NotificationOutcomeService(
        repository,
        new FixedScheduleBackoffPolicy(BACKOFF),
        properties,
        metrics,
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private void stubLocked(NotificationRecord record) {
    when(repository.findByIdForUpdate(ID)).thenReturn(Optional.of(record));
    when(repository.findById(ID)).thenReturn(Optional.of(record));
  }
}
