/*
 * どこで: Delivery Queue API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ 409 でも「状態遷移不可」と「claim 競合」をワーカーが区別できるようにするため
 */
package com.example.deliveryqueue.api;

public enum ApiErrorCode {
    BAD_REQUEST,
    NOTIFICATION_NOT_FOUND,
    INVALID_STATE_TRANSITION,
    ALREADY_CLAIMED_OR_INELIGIBLE
}
