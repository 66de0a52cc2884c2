/*
 * どこで: Delivery Queue API リクエスト DTO
 * 何を: enqueue API の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.example.deliveryqueue.api.request;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record EnqueueNotificationRequest(
    @NotBlank String template,
    @NotEmpty List<@NotBlank String> deliveryMethods,
    JsonNode templateData,
    @PositiveOrZero Long delaySeconds,
    String triggeredBy,
    @Positive Integer maxAttempts,
    Instant expiresAt,
    String customMessage,
    JsonNode metadata) {}
