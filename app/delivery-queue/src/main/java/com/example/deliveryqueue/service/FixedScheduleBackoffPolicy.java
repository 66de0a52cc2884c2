/*
 * どこで: Delivery Queue サービス層
 * 何を: 設定した固定スケジュール (既定 5m, 30m, 2h, 6h) からバックオフを引く
 * なぜ: 試行回数で添字を引き、末尾の値で頭打ちにするため
 */
package com.example.deliveryqueue.service;

import com.example.deliveryqueue.config.NotificationBackoffProperties;
import java.time.Duration;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class FixedScheduleBackoffPolicy implements BackoffPolicy {

  private final List<Duration> schedule;

  public FixedScheduleBackoffPolicy(NotificationBackoffProperties properties) {
    if (properties.schedule().isEmpty()) {
      throw new IllegalArgumentException("notification.backoff.schedule must not be empty");
    }
    this.schedule = properties.schedule();
  }

  @Override
  public Duration backoffFor(int attempts) {
    final int index = Math.min(Math.max(attempts, 0), schedule.size() - 1);
    return schedule.get(index);
  }
}
