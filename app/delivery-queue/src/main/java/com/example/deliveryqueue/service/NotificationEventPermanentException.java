/*
 * どこで: Delivery Queue サービス層
 * 何を: 承認イベントの恒久的な処理失敗を示す例外
 * なぜ: 再配信しても回復しないイベントを JetStream で TERM する判断に使うため
 */
package com.example.deliveryqueue.service;

public class NotificationEventPermanentException extends RuntimeException {

    public NotificationEventPermanentException(String message, Throwable cause) {
        super(message, cause);
    }
}
