/*
 * どこで: Delivery Queue サービス層
 * 何を: チャネル 1 つへの送信を抽象化するインターフェース
 * なぜ: メール/SMS/Push などの実送信とテスト用の差し替えを同じ経路で扱うため
 */
package com.example.deliveryqueue.service;

public interface ChannelSender {

  /**
   * Sends the message on one channel.
   *
   * @return the provider message id, or {@code null} when the provider returns none
   * @throws ChannelDeliveryException when the provider rejects or cannot accept the message
   */
  String send(String channel, ChannelMessage message);
}
