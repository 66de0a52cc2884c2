/*
 * どこで: Delivery Queue ドメインモデル
 * 何を: 通知キューの集計結果
 * なぜ: 管理画面/CLI が参照する統計の形を固定するため
 */
package com.example.deliveryqueue.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationStats(
    long total,
    Map<String, Long> byStatus,
    long pendingCount,
    long failedCount,
    long retryScheduledCount,
    BigDecimal averageAttempts,
    Map<String, Long> deliveryMethodsUsage,
    List<RecentFailure> recentFailures,
    Instant generatedAt) {

  public NotificationStats {
    byStatus = byStatus == null ? Map.of() : Map.copyOf(byStatus);
    deliveryMethodsUsage = deliveryMethodsUsage == null ? Map.of() : Map.copyOf(deliveryMethodsUsage);
    recentFailures = recentFailures == null ? List.of() : List.copyOf(recentFailures);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record RecentFailure(UUID id, String error, int attempts, Instant createdAt) {}
}
