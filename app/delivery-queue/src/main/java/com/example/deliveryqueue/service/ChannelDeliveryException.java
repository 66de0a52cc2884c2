/*
 * どこで: Delivery Queue サービス層
 * 何を: チャネル送信の失敗(拒否/タイムアウト/送信者未設定)を表す例外
 * なぜ: 送信失敗を reportFailure へ渡すエラー文言として一様に扱うため
 */
package com.example.deliveryqueue.service;

public class ChannelDeliveryException extends RuntimeException {

  public ChannelDeliveryException(String message) {
    super(message);
  }

  public ChannelDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
