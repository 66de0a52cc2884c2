/*
 * どこで: Delivery Queue データアクセス
 * 何を: notification_queue の読み取り専用集計を行う
 * なぜ: stats() を副作用なしで Record Store から直接計算するため
 */
package com.example.deliveryqueue.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;

import com.example.deliveryqueue.model.NotificationStats.RecentFailure;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationStatsRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Map<String, Long> countByStatus() {
    final String sql =
        """
        SELECT status, COUNT(*) AS status_count
        FROM notification_queue
        GROUP BY status
        ORDER BY status
        """;
    final Map<String, Long> counts = new LinkedHashMap<>();
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        rs -> {
          counts.put(rs.getString("status"), rs.getLong("status_count"));
        });
    return counts;
  }

  public BigDecimal averageAttempts() {
    final String sql =
        "SELECT COALESCE(ROUND(AVG(attempts)::numeric, 2), 0) FROM notification_queue";
    return jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), BigDecimal.class);
  }

  public Map<String, Long> countByDeliveryMethod() {
    final String sql =
        """
        SELECT method, COUNT(*) AS method_count
        FROM notification_queue, jsonb_array_elements_text(delivery_methods) AS method
        GROUP BY method
        ORDER BY method
        """;
    final Map<String, Long> counts = new LinkedHashMap<>();
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        rs -> {
          counts.put(rs.getString("method"), rs.getLong("method_count"));
        });
    return counts;
  }

  public List<RecentFailure> findRecentFailures(int limit) {
    final String sql =
        """
        SELECT id, last_error, attempts, created_at
        FROM notification_queue
        WHERE status = 'failed'
          AND last_error IS NOT NULL
        ORDER BY triggered_at DESC NULLS LAST, created_at DESC
        LIMIT :limit
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource().addValue("limit", limit),
        (rs, rowNum) ->
            new RecentFailure(
                UUID.fromString(rs.getString("id")),
                rs.getString("last_error"),
                rs.getInt("attempts"),
                getInstant(rs, "created_at")));
  }
}
