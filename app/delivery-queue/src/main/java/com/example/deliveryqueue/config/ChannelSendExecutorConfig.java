/*
 * どこで: Delivery Queue の設定
 * 何を: チャネル送信用の固定サイズスレッドプールを提供する
 * なぜ: 送信にタイムアウトを掛け、遅いプロバイダがワーカーのポーリングを止めないようにするため
 */
package com.example.deliveryqueue.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ChannelSendExecutorConfig {

  @Bean(name = "channelSendExecutor", destroyMethod = "shutdownNow")
  public ExecutorService channelSendExecutor(NotificationDeliveryProperties properties) {
    return Executors.newFixedThreadPool(
        properties.channelSendThreads(),
        new ThreadFactoryBuilder().setNameFormat("channel-send-%d").setDaemon(true).build());
  }
}
