/*
 * どこで: Delivery Queue 配信ワーカー
 * 何を: スケジュールで組み込みワーカーの 1 ポーリングを起動する
 * なぜ: 送信可能な通知を一定間隔で claim して配信するため
 */
package com.example.deliveryqueue.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.delivery.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class NotificationDeliveryWorker {

  private final NotificationDeliveryService deliveryService;

  @Scheduled(fixedDelayString = "${notification.delivery.poll-interval}")
  public void run() {
    deliveryService.processBatch();
  }
}
