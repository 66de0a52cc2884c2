/*
 * どこで: Delivery Queue API レスポンス DTO
 * 何を: 通知レコード 1 件の管理者向けビュー
 * なぜ: チャネル別結果やリース情報を含めて運用時に状態を確認できるようにするため
 */
package com.example.deliveryqueue.api.response;

import com.example.deliveryqueue.model.ChannelDeliveryStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はレスポンス返却専用であり、防御的コピーを行わないため")
public record NotificationResponse(
    UUID id,
    String status,
    List<String> deliveryMethods,
    Map<String, ChannelDeliveryStatus> deliveryStatus,
    int attempts,
    int maxAttempts,
    Instant nextAttemptAt,
    Instant sendAfter,
    Instant expiresAt,
    String template,
    JsonNode templateData,
    String customMessage,
    JsonNode metadata,
    List<String> reminderSchedule,
    int reminderCount,
    Instant lastReminderAt,
    String reminderTemplate,
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
    Instant createdAt) {}
