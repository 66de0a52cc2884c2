/*
 * どこで: Delivery Queue メトリクステスト
 * 何を: チャネル別配信結果/状態遷移/claim 競合/リース回収/リマインダー/backlog が記録されることを検証する
 * なぜ: キュー運用の指標名とタグの回帰を防ぐため
 */
package com.example.deliveryqueue.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class NotificationMetricsTest {

  @Test
  void recordsDeliveryAndQueueMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final NotificationMetrics metrics = new NotificationMetrics(registry);

    metrics.recordChannelResult("email", "sent");
    metrics.recordChannelResult("email", "sent");
    metrics.recordChannelResult("sms", "failed");
    metrics.recordOutcome("retry_scheduled");
    metrics.recordClaimConflict();
    metrics.recordLeaseRecovered();
    metrics.recordReminderPromoted();
    metrics.updateBacklogCurrent(5);

    final Counter emailSent =
        registry
            .get("notification.delivery.total")
            .tag("channel", "email")
            .tag("result", "sent")
            .counter();
    final Counter smsFailed =
        registry
            .get("notification.delivery.total")
            .tag("channel", "sms")
            .tag("result", "failed")
            .counter();
    final Counter retried =
        registry.get("notification.outcome.total").tag("status", "retry_scheduled").counter();
    final Gauge backlog = registry.get("notification.backlog.current").gauge();

    assertThat(emailSent.count()).isEqualTo(2.0d);
    assertThat(smsFailed.count()).isEqualTo(1.0d);
    assertThat(retried.count()).isEqualTo(1.0d);
    assertThat(registry.get("notification.claim.conflict.total").counter().count()).isEqualTo(1.0d);
    assertThat(registry.get("notification.lease.recovered.total").counter().count()).isEqualTo(1.0d);
    assertThat(registry.get("notification.reminder.promoted.total").counter().count()).isEqualTo(1.0d);
    assertThat(backlog.value()).isEqualTo(5.0d);
  }

  @Test
  void backlogNeverGoesNegative() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final NotificationMetrics metrics = new NotificationMetrics(registry);

    metrics.updateBacklogCurrent(-3);

    assertThat(registry.get("notification.backlog.current").gauge().value()).isZero();
  }
}
