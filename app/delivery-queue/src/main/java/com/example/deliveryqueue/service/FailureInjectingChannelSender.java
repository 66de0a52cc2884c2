/*
 * どこで: Delivery Queue サービス層
 * 何を: CI/Test 専用で指定チャネルの送信失敗を注入する Sender
 * なぜ: 実コード経路を汚さずに retry_scheduled -> failed や部分成功を E2E で再現するため
 */
package com.example.deliveryqueue.service;

import com.google.common.base.Splitter;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "notification.delivery.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingChannelSender implements ChannelSender {

  private final LocalChannelSender delegate;
  private final Set<String> failingChannels;
  private final String idPrefix;

  public FailureInjectingChannelSender(
      LocalChannelSender delegate,
      @Value("${notification.delivery.failure-injection.channels:}") String failingChannels,
      @Value("${notification.delivery.failure-injection.id-prefix:}") String idPrefix) {
    this.delegate = delegate;
    this.failingChannels =
        Splitter.on(',').trimResults().omitEmptyStrings().splitToStream(failingChannels)
            .map(channel -> channel.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    this.idPrefix = idPrefix;
  }

  @Override
  public String send(String channel, ChannelMessage message) {
    if (shouldInjectFailure(channel, message)) {
      throw new ChannelDeliveryException(
          "channel delivery failure injection matched channel=" + channel);
    }
    return delegate.send(channel, message);
  }

  private boolean shouldInjectFailure(String channel, ChannelMessage message) {
    if (!failingChannels.contains(channel)) {
      return false;
    }
    if (idPrefix == null || idPrefix.isBlank()) {
      return true;
    }
    return message.notificationId().toString().startsWith(idPrefix);
  }
}
