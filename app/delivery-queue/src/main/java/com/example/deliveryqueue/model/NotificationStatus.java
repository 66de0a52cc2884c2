/*
 * どこで: Delivery Queue ドメインモデル
 * 何を: 通知キューの状態を表す列挙
 * なぜ: DB の status 列 (小文字) と処理ロジックの状態を一致させるため
 */
package com.example.deliveryqueue.model;

import java.util.Locale;

public enum NotificationStatus {
  PENDING,
  PROCESSING,
  SENT,
  FAILED,
  RETRY_SCHEDULED,
  REMINDER_DUE,
  CANCELLED,
  PAUSED;

  public String dbValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static NotificationStatus fromDbValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("notification status is null");
    }
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
