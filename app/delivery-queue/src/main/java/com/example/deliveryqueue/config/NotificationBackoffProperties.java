/*
 * どこで: Delivery Queue の設定バインド
 * 何を: 失敗回数ごとの再送待ち時間スケジュールを保持する
 * なぜ: 固定配列 [5m, 30m, 2h, 6h] を設定から差し替えられるようにするため
 */
package com.example.deliveryqueue.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.backoff")
@Validated
public record NotificationBackoffProperties(@NotEmpty List<Duration> schedule) {

  public NotificationBackoffProperties {
    schedule = schedule == null ? List.of() : List.copyOf(schedule);
  }

  @AssertTrue(message = "notification.backoff.schedule must be positive and non-decreasing")
  public boolean isScheduleNonDecreasing() {
    Duration previous = Duration.ZERO;
    for (Duration delay : schedule) {
      if (delay == null || delay.isNegative() || delay.isZero() || delay.compareTo(previous) < 0) {
        return false;
      }
      previous = delay;
    }
    return true;
  }
}
