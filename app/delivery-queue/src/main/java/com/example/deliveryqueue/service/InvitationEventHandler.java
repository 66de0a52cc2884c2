/*
 * どこで: Delivery Queue サービス層
 * 何を: 招待承認イベントを冪等に enqueue へ変換する
 * なぜ: at-least-once 配信で同じイベントから通知を二重登録しないため
 */
package com.example.deliveryqueue.service;

import com.example.deliveryqueue.model.EnqueueCommand;
import com.example.deliveryqueue.model.InvitationApprovedEvent;
import com.example.deliveryqueue.repository.ProcessedEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class InvitationEventHandler {

  static final String DEFAULT_TRIGGERED_BY = "invitation_approved";

  private static final Logger logger = LoggerFactory.getLogger(InvitationEventHandler.class);

  private final ProcessedEventRepository processedEventRepository;
  private final NotificationAdminService adminService;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Transactional
  public void handleInvitationApproved(InvitationApprovedEvent event) {
    final UUID eventId = parseUuid(event.eventId(), "event_id");
    final UUID invitationId = parseUuid(event.invitationId(), "invitation_id");
    // processed_events に先行登録して重複処理を抑止する
    if (!processedEventRepository.insertIfAbsent(eventId, Instant.now(clock))) {
      logger.info("duplicate invitation event skipped eventId={} invitationId={}", eventId, invitationId);
      return;
    }
    final EnqueueCommand command =
        new EnqueueCommand(
            invitationId,
            event.template(),
            event.deliveryMethods(),
            toJson(event.templateData(), "template_data"),
            event.delaySeconds() == null ? Duration.ZERO : Duration.ofSeconds(event.delaySeconds()),
            event.triggeredBy() == null ? DEFAULT_TRIGGERED_BY : event.triggeredBy(),
            null,
            null,
            event.customMessage(),
            toJson(event.metadata(), "metadata"));
    try {
      adminService.enqueue(command);
      if (event.reminderDays() != null && !event.reminderDays().isEmpty()) {
        adminService.scheduleReminders(invitationId, null, event.reminderDays());
      }
    } catch (IllegalArgumentException ex) {
      // 入力不正は再配信しても回復しないため恒久的に扱う
      throw new NotificationEventPermanentException("invalid invitation event eventId=" + eventId, ex);
    }
    logger.info("invitation event enqueued eventId={} invitationId={}", eventId, invitationId);
  }

  private UUID parseUuid(String value, String field) {
    try {
      return UUID.fromString(value);
    } catch (RuntimeException ex) {
      throw new NotificationEventPermanentException("invalid invitation event " + field, ex);
    }
  }

  private String toJson(JsonNode node, String field) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (!node.isObject()) {
      throw new NotificationEventPermanentException(
          "invitation event " + field + " must be a JSON object", null);
    }
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      throw new NotificationEventPermanentException("invitation event " + field + " serialization failure", ex);
    }
  }
}
