/*
 * どこで: Delivery Queue サービス層
 * 何を: claim 競合または送信対象外を表す例外
 * なぜ: ワーカー API で「既に他ワーカーが取得済み/対象外」を 409 として返し、同一パスでの再試行を促さないため
 */
package com.example.deliveryqueue.service;

import java.util.UUID;

public class NotificationClaimConflictException extends RuntimeException {

  public NotificationClaimConflictException(UUID id) {
    super("notification already claimed or not eligible: " + id);
  }
}
