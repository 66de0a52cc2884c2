/*
 * どこで: Delivery Queue ドメインモデル
 * 何を: enqueue 操作の入力
 * なぜ: 管理 API と NATS イベントの両経路から同じ登録処理を呼ぶため
 */
package com.example.deliveryqueue.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record EnqueueCommand(
    UUID id,
    String template,
    List<String> deliveryMethods,
    String templateDataJson,
    Duration delay,
    String triggeredBy,
    Integer maxAttempts,
    Instant expiresAt,
    String customMessage,
    String metadataJson) {

  public EnqueueCommand {
    deliveryMethods = deliveryMethods == null ? List.of() : List.copyOf(deliveryMethods);
  }
}
