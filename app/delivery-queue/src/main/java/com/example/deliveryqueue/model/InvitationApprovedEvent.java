/*
 * どこで: Delivery Queue ドメインモデル
 * 何を: invitation.approved サブジェクトで受け取る JSON イベント
 * なぜ: 招待承認を通知キューへの enqueue (とリマインダー設定) に変換するため
 */
package com.example.deliveryqueue.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record InvitationApprovedEvent(
    String eventId,
    String invitationId,
    String occurredAt,
    String template,
    List<String> deliveryMethods,
    JsonNode templateData,
    Long delaySeconds,
    String triggeredBy,
    String customMessage,
    JsonNode metadata,
    List<Integer> reminderDays) {}
