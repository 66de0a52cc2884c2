/*
 * どこで: Delivery Queue ドメインモデル
 * 何を: delivery_status の 1 チャネル分の結果
 * なぜ: 既存の統計/監査コンシューマが読む JSON 形式 (sent_at/message_id, failed_at/error) を保つため
 */
package com.example.deliveryqueue.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChannelDeliveryStatus(
    String status, Instant sentAt, String messageId, Instant failedAt, String error) {

  public static final String SENT = "sent";
  public static final String FAILED = "failed";

  public static ChannelDeliveryStatus sent(Instant sentAt, String messageId) {
    return new ChannelDeliveryStatus(SENT, sentAt, messageId, null, null);
  }

  public static ChannelDeliveryStatus failed(Instant failedAt, String error) {
    return new ChannelDeliveryStatus(FAILED, null, null, failedAt, error);
  }

  @JsonIgnore
  public boolean isSent() {
    return SENT.equals(status);
  }

  @JsonIgnore
  public Instant timestamp() {
    return isSent() ? sentAt : failedAt;
  }
}
