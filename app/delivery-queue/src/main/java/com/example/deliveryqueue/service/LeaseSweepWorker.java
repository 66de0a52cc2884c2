/*
 * どこで: Delivery Queue リース回収ワーカー
 * 何を: スケジュールでリース切れの processing を回収する
 * なぜ: 外部ワーカーの停止で通知が止まったままにならないようにするため
 */
package com.example.deliveryqueue.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.delivery.lease-sweeper-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class LeaseSweepWorker {

  private final LeaseSweeper leaseSweeper;

  @Scheduled(fixedDelayString = "${notification.delivery.lease-sweep-interval}")
  public void run() {
    leaseSweeper.sweepExpiredLeases();
  }
}
