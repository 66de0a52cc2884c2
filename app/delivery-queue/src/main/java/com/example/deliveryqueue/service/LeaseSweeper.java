/*
 * どこで: Delivery Queue サービス層
 * 何を: リースが切れた processing を失敗 1 回として retry_scheduled/failed へ戻す
 * なぜ: claim 後にワーカーが落ちても通知が processing に取り残されないようにするため
 */
package com.example.deliveryqueue.service;

import com.example.deliveryqueue.config.NotificationDeliveryProperties;
import com.example.deliveryqueue.model.NotificationRecord;
import com.example.deliveryqueue.repository.NotificationQueueRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class LeaseSweeper {

  static final String LEASE_EXPIRED_ERROR = "processing lease expired";

  private static final Logger logger = LoggerFactory.getLogger(LeaseSweeper.class);

  private final NotificationQueueRepository repository;
  private final NotificationOutcomeService outcomeService;
  private final NotificationDeliveryProperties properties;
  private final NotificationMetrics metrics;
  private final Clock clock;

  @Transactional
  public int sweepExpiredLeases() {
    final Instant now = Instant.now(clock);
    final List<NotificationRecord> expired =
        repository.lockExpiredLeases(now, properties.batchSize());
    for (NotificationRecord record : expired) {
      logger.warn(
          "processing lease expired id={} claimedBy={} leaseUntil={}",
          record.id(),
          record.claimedBy(),
          record.leaseUntil());
      outcomeService.recordFailedAttempt(record, LEASE_EXPIRED_ERROR, now);
      metrics.recordLeaseRecovered();
    }
    return expired.size();
  }
}
