/*
 * どこで: Delivery Queue の設定バインド
 * 何を: NATS 接続設定をプロパティから読み込む
 * なぜ: 承認イベントの接続先を環境ごとに切り替え、テストでは無効化するため
 */
package com.example.deliveryqueue.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(boolean enabled, String url, Integer connectionTimeout) {}
