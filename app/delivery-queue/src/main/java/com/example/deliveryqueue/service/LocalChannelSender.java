/*
 * どこで: Delivery Queue サービス層
 * 何を: チャネル送信を模擬する実装
 * なぜ: 外部プロバイダを伴わずに claim から結果反映までの状態遷移を確認するため
 */
package com.example.deliveryqueue.service;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalChannelSender implements ChannelSender {

    private static final Logger logger = LoggerFactory.getLogger(LocalChannelSender.class);

    @Override
    public String send(String channel, ChannelMessage message) {
        // 実送信は行わず、ログに残すだけとする
        final String messageId = "local-" + UUID.randomUUID();
        logger.info("channel simulated send id={} channel={} template={} reminder={} messageId={}",
                message.notificationId(),
                channel,
                message.template(),
                message.reminder(),
                messageId);
        return messageId;
    }
}
