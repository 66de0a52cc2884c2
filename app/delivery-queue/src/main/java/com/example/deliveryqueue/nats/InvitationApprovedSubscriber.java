/*
 * どこで: Delivery Queue NATS 購読
 * 何を: invitation.approved の JetStream 購読を張り、受信イベントを InvitationEventHandler に渡して ack/nak/term を決める
 * なぜ: 招待承認から通知キューへの登録を非同期に繋ぎ、失敗の種類ごとに再配信の要否を分けるため
 */
package com.example.deliveryqueue.nats;

import com.example.deliveryqueue.config.InvitationNatsProperties;
import com.example.deliveryqueue.model.InvitationApprovedEvent;
import com.example.deliveryqueue.service.InvitationEventHandler;
import com.example.deliveryqueue.service.NotificationEventPermanentException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class InvitationApprovedSubscriber {

  private static final Logger logger = LoggerFactory.getLogger(InvitationApprovedSubscriber.class);

  /** How a received message is settled with JetStream. */
  enum Disposition {
    ACK(Message::ack),
    NAK(Message::nak),
    TERM(Message::term);

    private final Consumer<Message> action;

    Disposition(Consumer<Message> action) {
      this.action = action;
    }
  }

  private final Connection connection;
  private final InvitationEventHandler eventHandler;
  private final InvitationNatsProperties properties;
  private final ObjectMapper objectMapper;
  private Dispatcher dispatcher;
  private JetStreamSubscription subscription;

  public InvitationApprovedSubscriber(
      Connection connection,
      InvitationEventHandler eventHandler,
      InvitationNatsProperties properties,
      ObjectMapper objectMapper) {
    this.connection = connection;
    this.eventHandler = eventHandler;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @PostConstruct
  public synchronized void start() {
    if (subscription != null) {
      return;
    }
    try {
      final PushSubscribeOptions options = prepareConsumer();
      dispatcher = connection.createDispatcher();
      subscription =
          connection
              .jetStream()
              .subscribe(properties.subject(), dispatcher, this::handleMessage, false, options);
    } catch (IOException | JetStreamApiException ex) {
      stop();
      throw new IllegalStateException(
          "failed to subscribe to invitation events subject=" + properties.subject(), ex);
    }
    logger.info(
        "invitation subscriber started subject={} stream={} durable={} maxDeliver={}",
        properties.subject(),
        properties.stream(),
        properties.durable(),
        properties.maxDeliver());
  }

  @PreDestroy
  public synchronized void stop() {
    if (subscription != null) {
      subscription.unsubscribe();
      subscription = null;
    }
    if (dispatcher != null) {
      connection.closeDispatcher(dispatcher);
      dispatcher = null;
    }
  }

  @VisibleForTesting
  void handleMessage(Message message) {
    final Disposition disposition = dispatch(message.getData());
    try {
      disposition.action.accept(message);
    } catch (IllegalStateException ex) {
      // 接続断などで settle できなくても ack-wait 経過後に再配信される
      logger.warn("failed to settle invitation message disposition={}", disposition, ex);
    }
  }

  @VisibleForTesting
  Disposition dispatch(byte[] payload) {
    final InvitationApprovedEvent event;
    try {
      event = objectMapper.readValue(payload, InvitationApprovedEvent.class);
    } catch (IOException ex) {
      logger.warn("unreadable invitation event dropped bytes={}", payload == null ? 0 : payload.length, ex);
      return Disposition.TERM;
    }
    try (MDC.MDCCloseable ignored = MDC.putCloseable("notification_id", event.invitationId())) {
      eventHandler.handleInvitationApproved(event);
      return Disposition.ACK;
    } catch (NotificationEventPermanentException ex) {
      logger.warn(
          "invitation event rejected eventId={} invitationId={}", event.eventId(), event.invitationId(), ex);
      return Disposition.TERM;
    } catch (DataAccessException ex) {
      logger.warn(
          "invitation event deferred by store failure eventId={} invitationId={}",
          event.eventId(),
          event.invitationId(),
          ex);
      return Disposition.NAK;
    } catch (RuntimeException ex) {
      // 処理中レコードへの再登録などは配信完了後に通るため再配信させる
      logger.warn(
          "invitation event deferred eventId={} invitationId={} reason={}",
          event.eventId(),
          event.invitationId(),
          ex.getMessage());
      return Disposition.NAK;
    }
  }

  // Nats-Msg-Id の重複排除窓を持つ stream を用意し、明示 ack の durable consumer 設定を返す
  private PushSubscribeOptions prepareConsumer() throws IOException, JetStreamApiException {
    final StreamConfiguration stream =
        StreamConfiguration.builder()
            .name(properties.stream())
            .subjects(properties.subject())
            .duplicateWindow(properties.duplicateWindow())
            .build();
    final JetStreamManagement management = connection.jetStreamManagement();
    try {
      management.updateStream(stream);
    } catch (JetStreamApiException ex) {
      // 10059 = stream not found
      if (ex.getApiErrorCode() != 10059 && ex.getErrorCode() != 404) {
        throw ex;
      }
      management.addStream(stream);
      logger.info("invitation stream created stream={}", properties.stream());
    }
    return PushSubscribeOptions.builder()
        .stream(properties.stream())
        .durable(properties.durable())
        .configuration(
            ConsumerConfiguration.builder()
                .ackPolicy(AckPolicy.Explicit)
                .ackWait(properties.ackWait())
                .maxDeliver(properties.maxDeliver())
                .build())
        .build();
  }
}
