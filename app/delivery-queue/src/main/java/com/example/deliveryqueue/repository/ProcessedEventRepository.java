/*
 * どこで: Delivery Queue データアクセス
 * 何を: processed_events へ受信済みイベントを登録する
 * なぜ: JetStream の再配信で同じ承認イベントから二重に enqueue しないため
 */
package com.example.deliveryqueue.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ProcessedEventRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    // 一意制約違反を例外にするとトランザクションが中断するため ON CONFLICT で吸収する
    public boolean insertIfAbsent(UUID eventId, Instant processedAt) {
        String sql = """
                INSERT INTO processed_events (event_id, processed_at)
                VALUES (:eventId, :processedAt)
                ON CONFLICT (event_id) DO NOTHING
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("eventId", eventId)
                .addValue("processedAt", toTimestamp(processedAt));
        return jdbcTemplate.update(sql, params) > 0;
    }
}
