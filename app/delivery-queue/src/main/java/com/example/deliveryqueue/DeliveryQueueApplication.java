/*
 * どこで: Delivery Queue アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: 設定クラスと配信/リマインダー/リース回収のスケジュールをまとめて有効化するため
 */
package com.example.deliveryqueue;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class DeliveryQueueApplication {

	public static void main(String[] args) {
		SpringApplication.run(DeliveryQueueApplication.class, args);
	}
}
