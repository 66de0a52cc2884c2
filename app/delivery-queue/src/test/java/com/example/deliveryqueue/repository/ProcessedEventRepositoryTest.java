/*
 * どこで: ProcessedEventRepository の統合テスト
 * 何を: insertIfAbsent が同じ event_id の 2 回目を抑止することを検証する
 * なぜ: JetStream 再配信時の冪等性が DB 制約で保たれることを保証するため
 */
package com.example.deliveryqueue.repository;

import com.example.deliveryqueue.AbstractPostgresContainerTest;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ProcessedEventRepositoryTest extends AbstractPostgresContainerTest {

    private static final Instant BASE_TIME = Instant.parse("2026-03-01T00:00:00Z");

    @Autowired
    private ProcessedEventRepository processedEventRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanup() {
        jdbcTemplate.update("DELETE FROM processed_events", new MapSqlParameterSource());
    }

    @Test
    void insertIfAbsentReturnsFalseOnDuplicateEventId() {
        UUID eventId = UUID.randomUUID();

        boolean firstInsert = processedEventRepository.insertIfAbsent(eventId, BASE_TIME);
        boolean secondInsert = processedEventRepository.insertIfAbsent(eventId, BASE_TIME.plus(Duration.ofMinutes(1)));

        assertThat(firstInsert).isTrue();
        assertThat(secondInsert).isFalse();
        assertThat(processedAt(eventId)).isEqualTo(BASE_TIME);
    }

    @Test
    void distinctEventIdsAreBothRecorded() {
        assertThat(processedEventRepository.insertIfAbsent(UUID.randomUUID(), BASE_TIME)).isTrue();
        assertThat(processedEventRepository.insertIfAbsent(UUID.randomUUID(), BASE_TIME)).isTrue();
        assertThat(countAll()).isEqualTo(2);
    }

    private int countAll() {
        Integer result = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM processed_events",
                new MapSqlParameterSource(),
                Integer.class);
        return result == null ? 0 : result;
    }

    // 最初の登録時刻が上書きされていないことを確認する
    private Instant processedAt(UUID eventId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("eventId", eventId);
        Timestamp result = jdbcTemplate.queryForObject(
                "SELECT processed_at FROM processed_events WHERE event_id = :eventId",
                params,
                Timestamp.class);
        return result == null ? null : result.toInstant();
    }
}
