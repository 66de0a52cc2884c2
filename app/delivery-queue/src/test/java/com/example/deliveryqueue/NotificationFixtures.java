package com.example.deliveryqueue;

import com.example.deliveryqueue.model.ChannelDeliveryStatus;
import com.example.deliveryqueue.model.NotificationRecord;
import com.example.deliveryqueue.model.NotificationStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Record builders shared by unit tests. */
public final class NotificationFixtures {

  private NotificationFixtures() {}

  public static NotificationRecord.NotificationRecordBuilder pending(UUID id, Instant createdAt) {
    return NotificationRecord.builder()
        .id(id)
        .status(NotificationStatus.PENDING)
        .deliveryMethods(List.of("email"))
        .deliveryStatus(Map.of())
        .attempts(0)
        .maxAttempts(3)
        .sendAfter(createdAt)
        .template("invitation_approved")
        .templateDataJson("{}")
        .metadataJson("{}")
        .reminderSchedule(List.of())
        .episodeStartedAt(createdAt)
        .triggeredBy("system")
        .triggeredAt(createdAt)
        .createdAt(createdAt);
  }

  public static NotificationRecord processing(
      UUID id, List<String> channels, int attempts, Instant claimedAt) {
    return pending(id, claimedAt.minusSeconds(60))
        .status(NotificationStatus.PROCESSING)
        .deliveryMethods(channels)
        .attempts(attempts)
        .claimedBy("worker-1")
        .claimedAt(claimedAt)
        .leaseUntil(claimedAt.plusSeconds(900))
        .build();
  }

  public static NotificationRecord withSent(NotificationRecord record, String channel, Instant sentAt) {
    return record.withChannelStatus(channel, ChannelDeliveryStatus.sent(sentAt, "msg-" + channel));
  }

  public static NotificationRecord withFailed(NotificationRecord record, String channel, Instant failedAt) {
    return record.withChannelStatus(channel, ChannelDeliveryStatus.failed(failedAt, channel + " down"));
  }
}
