/*
 * どこで: Delivery Queue サービス層
 * 何を: 複数チャネル配信で「送信完了」とみなす条件
 * なぜ: 部分成功の扱いを設定で明示し、両方の方針をテストできるようにするため
 */
package com.example.deliveryqueue.service;

import com.example.deliveryqueue.model.NotificationRecord;

public enum ChannelCompletionPolicy {

  /** Every requested channel must succeed; the first failure schedules a retry. */
  ALL_CHANNELS {
    @Override
    public boolean isDelivered(NotificationRecord record) {
      return record.outstandingChannels().isEmpty();
    }

    @Override
    public boolean isFailureFinal(NotificationRecord record) {
      return true;
    }
  },

  /** One successful channel completes the record; a failure waits for the other channels. */
  ANY_CHANNEL {
    @Override
    public boolean isDelivered(NotificationRecord record) {
      return record.deliveryMethods().stream().anyMatch(record::isDeliveredInEpisode);
    }

    @Override
    public boolean isFailureFinal(NotificationRecord record) {
      return record.deliveryMethods().stream()
          .allMatch(channel -> record.isDeliveredInEpisode(channel) || record.isReportedSinceClaim(channel));
    }
  };

  public abstract boolean isDelivered(NotificationRecord record);

  /** Whether a failure report leaves no channel of the current claim unreported. */
  public abstract boolean isFailureFinal(NotificationRecord record);
}
