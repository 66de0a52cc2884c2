/*
 * どこで: Delivery Queue ドメインモデル
 * 何を: 送信可能な通知 1 件分のワーカー向けビュー
 * なぜ: pickBatch で送信に必要な項目だけをワーカーへ渡すため
 */
package com.example.deliveryqueue.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record EligibleNotification(
    UUID id,
    NotificationStatus status,
    String template,
    String templateDataJson,
    String customMessage,
    String metadataJson,
    List<String> deliveryMethods,
    List<String> outstandingChannels,
    int attempts,
    int maxAttempts,
    boolean reminderEpisode,
    Instant sendAfter,
    Instant createdAt) {

  public EligibleNotification {
    deliveryMethods = deliveryMethods == null ? List.of() : List.copyOf(deliveryMethods);
    outstandingChannels = outstandingChannels == null ? List.of() : List.copyOf(outstandingChannels);
  }

  public static EligibleNotification from(NotificationRecord record) {
    return new EligibleNotification(
        record.id(),
        record.status(),
        record.effectiveTemplate(),
        record.templateDataJson(),
        record.customMessage(),
        record.metadataJson(),
        record.deliveryMethods(),
        record.outstandingChannels(),
        record.attempts(),
        record.maxAttempts(),
        record.reminderEpisode(),
        record.sendAfter(),
        record.createdAt());
  }
}
