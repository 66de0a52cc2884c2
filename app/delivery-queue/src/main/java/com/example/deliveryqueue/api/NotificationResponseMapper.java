/*
 * どこで: Delivery Queue API
 * 何を: ドメインの通知レコードを API レスポンスへ変換する
 * なぜ: jsonb で保持したテンプレートデータ/メタデータを JSON オブジェクトとして返すため
 */
package com.example.deliveryqueue.api;

import com.example.deliveryqueue.api.request.EnqueueNotificationRequest;
import com.example.deliveryqueue.api.response.EligibleNotificationResponse;
import com.example.deliveryqueue.api.response.NotificationResponse;
import com.example.deliveryqueue.model.EligibleNotification;
import com.example.deliveryqueue.model.EnqueueCommand;
import com.example.deliveryqueue.model.NotificationRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationResponseMapper {

  private final ObjectMapper objectMapper;

  public EnqueueCommand toCommand(UUID id, EnqueueNotificationRequest request) {
    return new EnqueueCommand(
        id,
        request.template(),
        request.deliveryMethods(),
        writeObject(request.templateData(), "template_data"),
        request.delaySeconds() == null ? Duration.ZERO : Duration.ofSeconds(request.delaySeconds()),
        request.triggeredBy(),
        request.maxAttempts(),
        request.expiresAt(),
        request.customMessage(),
        writeObject(request.metadata(), "metadata"));
  }

  public NotificationResponse toResponse(NotificationRecord record) {
    return new NotificationResponse(
        record.id(),
        record.status().dbValue(),
        record.deliveryMethods(),
        record.deliveryStatus(),
        record.attempts(),
        record.maxAttempts(),
        record.nextAttemptAt(),
        record.sendAfter(),
        record.expiresAt(),
        record.template(),
        readTree(record.templateDataJson()),
        record.customMessage(),
        readTree(record.metadataJson()),
        record.reminderSchedule(),
        record.reminderCount(),
        record.lastReminderAt(),
        record.reminderTemplate(),
        record.lastError(),
        record.triggeredBy(),
        record.triggeredAt(),
        record.completedAt(),
        record.claimedBy(),
        record.claimedAt(),
        record.leaseUntil(),
        record.emailSent(),
        record.emailSentAt(),
        record.emailMessageId(),
        record.createdAt());
  }

  public EligibleNotificationResponse toResponse(EligibleNotification notification) {
    return new EligibleNotificationResponse(
        notification.id(),
        notification.status().dbValue(),
        notification.template(),
        readTree(notification.templateDataJson()),
        notification.customMessage(),
        readTree(notification.metadataJson()),
        notification.deliveryMethods(),
        notification.outstandingChannels(),
        notification.attempts(),
        notification.maxAttempts(),
        notification.reminderEpisode(),
        notification.sendAfter(),
        notification.createdAt());
  }

  private JsonNode readTree(String json) {
    if (json == null) {
      return null;
    }
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("stored notification json is unreadable", ex);
    }
  }

  private String writeObject(JsonNode node, String field) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (!node.isObject()) {
      throw new IllegalArgumentException(field + " must be a JSON object");
    }
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException(field + " is invalid", ex);
    }
  }
}
