/*
 * どこで: Delivery Queue サービス層
 * 何を: 送信可能な通知を条件付き UPDATE で processing へ移し、リースを付与する
 * なぜ: 複数ワーカーが同じ行を選んでも送信者を 1 つに限定するため
 */
package com.example.deliveryqueue.service;

import com.example.deliveryqueue.config.NotificationDeliveryProperties;
import com.example.deliveryqueue.model.NotificationRecord;
import com.example.deliveryqueue.repository.NotificationQueueRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationClaimService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationClaimService.class);

  private final NotificationQueueRepository repository;
  private final NotificationDeliveryProperties properties;
  private final NotificationMetrics metrics;
  private final Clock clock;

  /**
   * Claims the notification for {@code claimedBy}.
   *
   * @return the claimed record, or empty when another worker won or the row is no longer eligible
   */
  public Optional<NotificationRecord> claim(UUID id, String claimedBy) {
    if (claimedBy == null || claimedBy.isBlank()) {
      throw new IllegalArgumentException("worker id is required");
    }
    final Instant now = Instant.now(clock);
    final Optional<NotificationRecord> claimed =
        repository.claim(id, now, now.plus(properties.lease()), claimedBy);
    if (claimed.isEmpty()) {
      metrics.recordClaimConflict();
      logger.debug("notification claim lost id={} worker={}", id, claimedBy);
      return Optional.empty();
    }
    logger.info(
        "notification claimed id={} worker={} leaseUntil={}",
        id,
        claimedBy,
        claimed.get().leaseUntil());
    return claimed;
  }
}
