/*
 * どこで: Delivery Queue サービス層
 * 何を: チャネル別配信結果/claim 競合/リース回収/リマインダー昇格/backlog のメトリクスを記録する
 * なぜ: キューの滞留と失敗傾向を Prometheus から直接観測できるようにするため
 */
package com.example.deliveryqueue.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NotificationMetrics {

  private static final String METRIC_DELIVERY_TOTAL = "notification.delivery.total";
  private static final String METRIC_OUTCOME_TOTAL = "notification.outcome.total";
  private static final String METRIC_CLAIM_CONFLICT_TOTAL = "notification.claim.conflict.total";
  private static final String METRIC_LEASE_RECOVERED_TOTAL = "notification.lease.recovered.total";
  private static final String METRIC_REMINDER_PROMOTED_TOTAL = "notification.reminder.promoted.total";
  private static final String METRIC_BACKLOG_CURRENT = "notification.backlog.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> outcomeCounters = new ConcurrentHashMap<>();
  private final Counter claimConflictCounter;
  private final Counter leaseRecoveredCounter;
  private final Counter reminderPromotedCounter;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicInteger::get)
        .description("Current number of notifications eligible for delivery")
        .register(meterRegistry);
    this.claimConflictCounter =
        Counter.builder(METRIC_CLAIM_CONFLICT_TOTAL)
            .description("Claims lost to another worker or to an eligibility change")
            .register(meterRegistry);
    this.leaseRecoveredCounter =
        Counter.builder(METRIC_LEASE_RECOVERED_TOTAL)
            .description("Processing notifications recovered after their lease expired")
            .register(meterRegistry);
    this.reminderPromotedCounter =
        Counter.builder(METRIC_REMINDER_PROMOTED_TOTAL)
            .description("Sent notifications reopened for a reminder")
            .register(meterRegistry);
  }

  public void recordChannelResult(String channel, String result) {
    deliveryCounters
        .computeIfAbsent(
            channel + ":" + result,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Per-channel delivery outcomes")
                    .tags(Tags.of("channel", channel, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  // 状態遷移の結果 (sent/retry_scheduled/failed)
  public void recordOutcome(String status) {
    outcomeCounters
        .computeIfAbsent(
            status,
            ignored ->
                Counter.builder(METRIC_OUTCOME_TOTAL)
                    .description("Notification state transitions after processing")
                    .tags(Tags.of("status", status))
                    .register(meterRegistry))
        .increment();
  }

  public void recordClaimConflict() {
    claimConflictCounter.increment();
  }

  public void recordLeaseRecovered() {
    leaseRecoveredCounter.increment();
  }

  public void recordReminderPromoted() {
    reminderPromotedCounter.increment();
  }

  public void updateBacklogCurrent(int backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }
}
