/*
 * どこで: Delivery Queue API レスポンス DTO
 * 何を: ワーカーが取得する送信候補 1 件
 * なぜ: 送信に必要なテンプレートと未送信チャネルだけを返すため
 */
package com.example.deliveryqueue.api.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はレスポンス返却専用であり、防御的コピーを行わないため")
public record EligibleNotificationResponse(
    UUID id,
    String status,
    String template,
    JsonNode templateData,
    String customMessage,
    JsonNode metadata,
    List<String> deliveryMethods,
    List<String> outstandingChannels,
    int attempts,
    int maxAttempts,
    boolean reminder,
    Instant sendAfter,
    Instant createdAt) {}
