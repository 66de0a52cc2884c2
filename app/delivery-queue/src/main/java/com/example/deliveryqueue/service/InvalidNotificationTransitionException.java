/*
 * どこで: Delivery Queue サービス層
 * 何を: 現在の状態から許されない操作(409)を表す例外
 * なぜ: 処理中レコードの再登録や終端状態の取消を明確に拒否するため
 */
package com.example.deliveryqueue.service;

public class InvalidNotificationTransitionException extends RuntimeException {

    public InvalidNotificationTransitionException(String message) {
        super(message);
    }
}
