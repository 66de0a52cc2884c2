/*
 * どこで: Delivery Queue アプリのスモークテスト
 * 何を: Spring コンテキストの起動と主要 Bean の配線を確認する
 * なぜ: 設定バインドやサービス間の依存が壊れていないことを担保するため
 */
package com.example.deliveryqueue;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.deliveryqueue.service.ChannelSender;
import com.example.deliveryqueue.service.LocalChannelSender;
import com.example.deliveryqueue.service.NotificationDeliveryService;
import com.example.deliveryqueue.service.NotificationDeliveryWorker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class DeliveryQueueApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private ApplicationContext context;

  @Test
  void contextLoads() {
    assertThat(context.getBean(NotificationDeliveryService.class)).isNotNull();
    // failure-injection 無効時は模擬 Sender がそのまま使われる
    assertThat(context.getBean(ChannelSender.class)).isInstanceOf(LocalChannelSender.class);
    // test プロファイルではスケジュール起動を止め、テストから明示的に呼び出す
    assertThat(context.getBeanNamesForType(NotificationDeliveryWorker.class)).isEmpty();
  }
}
