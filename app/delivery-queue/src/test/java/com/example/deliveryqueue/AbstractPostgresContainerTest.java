/*
 * どこで: Delivery Queue テスト基盤
 * 何を: Testcontainers(Postgres) と DataSource/Flyway の共通設定を提供する
 * なぜ: 条件付き UPDATE や SKIP LOCKED など Postgres 固有の挙動を本物の DB で検証するため
 */
package com.example.deliveryqueue;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

public abstract class AbstractPostgresContainerTest {

    // JVM 内のテスト全体で共通の Postgres コンテナを使い回し、起動コストを抑える
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    static {
        // Docker が無い環境ではここで失敗させ、DB 依存のテストを黙ってスキップしない
        POSTGRES.start();
    }

    @DynamicPropertySource
    static void registerProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);

        registry.add("spring.datasource.hikari.schema", () -> "delivery_queue");

        // Flyway は本番同等の migration を使う
        registry.add("spring.flyway.enabled", () -> "true");
        registry.add("spring.flyway.locations", () -> "classpath:db/migration");
        registry.add("spring.flyway.default-schema", () -> "delivery_queue");
        registry.add("spring.flyway.schemas", () -> "delivery_queue");
        registry.add("spring.flyway.create-schemas", () -> "true");
        registry.add("spring.flyway.table", () -> "flyway_schema_history_delivery_queue");
    }
}
