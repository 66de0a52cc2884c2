/*
 * どこで: Delivery Queue サービス層
 * 何を: 送信可能な通知を優先度 (retry_scheduled > reminder_due > pending) と作成順で選ぶ
 * なぜ: 読み取り専用の選択と claim を分け、ワーカーが自分のペースで取得できるようにするため
 */
package com.example.deliveryqueue.service;

import com.example.deliveryqueue.model.EligibleNotification;
import com.example.deliveryqueue.repository.NotificationQueueRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationSelector {

  private final NotificationQueueRepository repository;
  private final NotificationMetrics metrics;
  private final Clock clock;

  /**
   * Returns up to {@code limit} eligible notifications without changing any state.
   *
   * <p>The same rows may be returned to several workers; only {@link NotificationClaimService}
   * decides who delivers them.
   */
  public List<EligibleNotification> pickBatch(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive");
    }
    final Instant now = Instant.now(clock);
    return repository.findEligible(now, limit).stream().map(EligibleNotification::from).toList();
  }

  public int refreshBacklog() {
    final int backlog = repository.countEligible(Instant.now(clock));
    metrics.updateBacklogCurrent(backlog);
    return backlog;
  }
}
