/*
 * どこで: Delivery Queue サービス層
 * 何を: 通知レコード未検出を表す例外
 * なぜ: 管理/ワーカー API の 404 応答へ変換するため
 */
package com.example.deliveryqueue.service;

import java.util.UUID;

public class NotificationNotFoundException extends RuntimeException {

  public NotificationNotFoundException(UUID id) {
    super("notification not found: " + id);
  }
}
