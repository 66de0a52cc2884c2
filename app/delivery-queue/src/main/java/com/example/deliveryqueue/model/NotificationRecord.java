/*
 * どこで: Delivery Queue ドメインモデル
 * 何を: notification_queue テーブルのスナップショット
 * なぜ: 選択/claim/結果反映/管理 API で同じ行表現を共有するため
 */
package com.example.deliveryqueue.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;

@Builder(toBuilder = true)
public record NotificationRecord(
    UUID id,
    NotificationStatus status,
    List<String> deliveryMethods,
    Map<String, ChannelDeliveryStatus> deliveryStatus,
    int attempts,
    int maxAttempts,
    Instant nextAttemptAt,
    Instant sendAfter,
    Instant expiresAt,
    String template,
    String templateDataJson,
    String customMessage,
    String metadataJson,
    List<String> reminderSchedule,
    int reminderCount,
    Instant lastReminderAt,
    String reminderTemplate,
    boolean reminderEpisode,
    Instant episodeStartedAt,
    String lastError,
    String triggeredBy,
    Instant triggeredAt,
    Instant completedAt,
    String claimedBy,
    Instant claimedAt,
    Instant leaseUntil,
    boolean emailSent,
    Instant emailSentAt,
    String emailMessageId,
    int emailAttempts,
    String lastEmailError,
    Instant createdAt) {

  public NotificationRecord {
    deliveryMethods = deliveryMethods == null ? List.of() : List.copyOf(deliveryMethods);
    deliveryStatus = deliveryStatus == null ? Map.of() : Map.copyOf(deliveryStatus);
    reminderSchedule = reminderSchedule == null ? List.of() : List.copyOf(reminderSchedule);
  }

  /** Channels of the current episode that have no successful delivery yet, in request order. */
  public List<String> outstandingChannels() {
    return deliveryMethods.stream().filter(channel -> !isDeliveredInEpisode(channel)).toList();
  }

  public boolean isDeliveredInEpisode(String channel) {
    final ChannelDeliveryStatus entry = deliveryStatus.get(channel);
    if (entry == null || !entry.isSent()) {
      return false;
    }
    final Instant sentAt = entry.timestamp();
    return episodeStartedAt == null || (sentAt != null && !sentAt.isBefore(episodeStartedAt));
  }

  /** Whether the channel already has an outcome (sent or failed) reported under the current claim. */
  public boolean isReportedSinceClaim(String channel) {
    final ChannelDeliveryStatus entry = deliveryStatus.get(channel);
    if (entry == null || claimedAt == null || entry.timestamp() == null) {
      return false;
    }
    return !entry.timestamp().isBefore(claimedAt);
  }

  public NotificationRecord withChannelStatus(String channel, ChannelDeliveryStatus entry) {
    final Map<String, ChannelDeliveryStatus> merged = new LinkedHashMap<>(deliveryStatus);
    merged.put(channel, entry);
    return toBuilder().deliveryStatus(merged).build();
  }

  public boolean hasPendingReminder() {
    return reminderCount < reminderSchedule.size();
  }

  public String effectiveTemplate() {
    if (reminderEpisode && reminderTemplate != null && !reminderTemplate.isBlank()) {
      return reminderTemplate;
    }
    return template;
  }
}
