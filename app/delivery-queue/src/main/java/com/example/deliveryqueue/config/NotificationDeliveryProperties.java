/*
 * どこで: Delivery Queue の設定バインド
 * 何を: ワーカーのポーリング/claim リース/チャネル送信タイムアウト設定を保持する
 * なぜ: 運用パラメータを外部化し、起動時に妥当性を検証するため
 */
package com.example.deliveryqueue.config;

import com.example.deliveryqueue.service.ChannelCompletionPolicy;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.delivery")
@Validated
public record NotificationDeliveryProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @Positive int batchSize,
    @Positive int defaultMaxAttempts,
    @NotNull Duration lease,
    @NotNull Duration leaseSweepInterval,
    @NotNull Duration channelSendTimeout,
    @Positive int channelSendThreads,
    @Positive int errorMessageMaxLength,
    @NotNull ChannelCompletionPolicy completionPolicy) {

  @AssertTrue(message = "notification.delivery.lease must be positive")
  public boolean isLeasePositive() {
    return isPositiveDuration(lease);
  }

  @AssertTrue(message = "notification.delivery.channel-send-timeout must be shorter than lease")
  public boolean isChannelSendTimeoutWithinLease() {
    // 送信タイムアウトがリースより長いと、送信中にスイーパーが回収してしまう
    if (!isPositiveDuration(channelSendTimeout) || !isPositiveDuration(lease)) {
      return false;
    }
    return channelSendTimeout.compareTo(lease) < 0;
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
