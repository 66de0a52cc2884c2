/*
 * どこで: Delivery Queue サービス層
 * 何を: 失敗回数から次回送信までの待ち時間を決める方針
 * なぜ: 状態遷移を変えずにテンプレート/チャネル別のバックオフへ差し替えられるようにするため
 */
package com.example.deliveryqueue.service;

import java.time.Duration;

public interface BackoffPolicy {

  /**
   * Delay before the next attempt, given how many attempts have already failed.
   *
   * @param attempts failed attempts recorded before the current failure
   */
  Duration backoffFor(int attempts);
}
