package com.example.deliveryqueue.service;

import com.example.deliveryqueue.model.NotificationRecord;
import java.util.UUID;

/** Payload handed to a {@link ChannelSender}; template data and metadata stay opaque JSON. */
public record ChannelMessage(
    UUID notificationId,
    String template,
    String templateDataJson,
    String customMessage,
    String metadataJson,
    boolean reminder,
    int attempt) {

  public static ChannelMessage from(NotificationRecord record) {
    return new ChannelMessage(
        record.id(),
        record.effectiveTemplate(),
        record.templateDataJson(),
        record.customMessage(),
        record.metadataJson(),
        record.reminderEpisode(),
        record.attempts() + 1);
  }
}
