/*
 * どこで: Delivery Queue サービス層
 * 何を: 組み込みワーカーとして pickBatch -> claim -> チャネル送信 -> 結果報告を実行する
 * なぜ: 外部ワーカーと同じ公開操作だけで配信し、送信 IO をトランザクションの外に置くため
 */
package com.example.deliveryqueue.service;

import com.example.deliveryqueue.config.NotificationDeliveryProperties;
import com.example.deliveryqueue.model.EligibleNotification;
import com.example.deliveryqueue.model.NotificationRecord;
import com.example.deliveryqueue.model.NotificationStatus;
import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class NotificationDeliveryService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationDeliveryService.class);
    private static final String HOSTNAME_ENV = "HOSTNAME";
    private static final String DEFAULT_HOSTNAME = "unknown-host";
    private static final String MDC_NOTIFICATION_ID = "notification_id";

    private final NotificationSelector selector;
    private final NotificationClaimService claimService;
    private final NotificationOutcomeService outcomeService;
    private final ChannelSender sender;
    private final NotificationDeliveryProperties properties;
    private final ExecutorService channelSendExecutor;
    private volatile String workerId;

    public NotificationDeliveryService(
            NotificationSelector selector,
            NotificationClaimService claimService,
            NotificationOutcomeService outcomeService,
            ChannelSender sender,
            NotificationDeliveryProperties properties,
            @Qualifier("channelSendExecutor") ExecutorService channelSendExecutor) {
        this.selector = selector;
        this.claimService = claimService;
        this.outcomeService = outcomeService;
        this.sender = sender;
        this.properties = properties;
        this.channelSendExecutor = channelSendExecutor;
    }

    /** Runs one poll: picks a batch, claims each candidate and delivers the ones it won. */
    public int processBatch() {
        final String claimedBy = workerId();
        final List<EligibleNotification> batch = selector.pickBatch(properties.batchSize());
        int processed = 0;
        for (EligibleNotification candidate : batch) {
            // 他ワーカーに取られた候補はこのパスでは再試行しない
            final Optional<NotificationRecord> claimed = claimService.claim(candidate.id(), claimedBy);
            if (claimed.isEmpty()) {
                continue;
            }
            MDC.put(MDC_NOTIFICATION_ID, candidate.id().toString());
            try {
                deliver(claimed.get());
                processed++;
            } catch (DataAccessException | NotificationNotFoundException | InvalidNotificationTransitionException ex) {
                // 報告に失敗したレコードは processing のまま残り、リース切れでスイーパーが回収する
                logger.error("notification delivery aborted id={}", candidate.id(), ex);
            } finally {
                MDC.remove(MDC_NOTIFICATION_ID);
            }
        }
        selector.refreshBacklog();
        return processed;
    }

    @VisibleForTesting
    void deliver(NotificationRecord record) {
        if (properties.completionPolicy().isDelivered(record)) {
            outcomeService.completeIfDelivered(record.id());
            return;
        }
        final ChannelMessage message = ChannelMessage.from(record);
        for (String channel : record.outstandingChannels()) {
            final NotificationRecord after;
            try {
                final String messageId = sendWithTimeout(channel, message);
                after = outcomeService.reportSuccess(record.id(), channel, messageId, record.claimedBy());
            } catch (ChannelDeliveryException ex) {
                logger.warn("channel send failed id={} channel={} error={}", record.id(), channel, ex.getMessage());
                final NotificationRecord failed =
                        outcomeService.reportFailure(record.id(), channel, ex.getMessage(), record.claimedBy());
                if (failed.status() == NotificationStatus.CANCELLED) {
                    logger.info("notification cancelled during delivery id={}", record.id());
                    return;
                }
                continue;
            }
            if (after.status() == NotificationStatus.CANCELLED) {
                logger.info("notification cancelled during delivery id={}", record.id());
                return;
            }
        }
    }

    @VisibleForTesting
    String sendWithTimeout(String channel, ChannelMessage message) {
        final Duration timeout = properties.channelSendTimeout();
        final Future<String> future;
        try {
            future = channelSendExecutor.submit(() -> sender.send(channel, message));
        } catch (RejectedExecutionException ex) {
            throw new ChannelDeliveryException("channel send rejected: " + channel, ex);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new ChannelDeliveryException("channel send timed out after " + timeout, ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ChannelDeliveryException("channel send interrupted", ex);
        } catch (ExecutionException ex) {
            final Throwable cause = ex.getCause();
            if (cause instanceof ChannelDeliveryException deliveryException) {
                throw deliveryException;
            }
            final String detail = cause == null || cause.getMessage() == null
                    ? "channel send failed"
                    : cause.getMessage();
            throw new ChannelDeliveryException(detail, cause);
        }
    }

    private String workerId() {
        String resolved = workerId;
        if (resolved == null) {
            resolved = resolveWorkerId();
            workerId = resolved;
        }
        return resolved;
    }

    @VisibleForTesting
    String resolveWorkerId() {
        final String host = resolveHostname();
        return host + "-" + ProcessHandle.current().pid();
    }

    private String resolveHostname() {
        String env = System.getenv(HOSTNAME_ENV);
        if (env != null && !env.isBlank()) {
            return env;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException | SecurityException ex) {
            logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
            return DEFAULT_HOSTNAME;
        }
    }
}
