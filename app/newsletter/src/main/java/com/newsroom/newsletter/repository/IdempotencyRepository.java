/*
 * どこで: Newsletter データアクセス
 * 何を: idempotency の予約/保存済みレスポンス取得/完了更新/期限切れ削除を担う
 * なぜ: 再送や同時送信された publish を 1 回の処理にまとめるため
 */
package com.newsroom.newsletter.repository;

import static com.newsroom.common.JdbcTimestampUtils.toInstant;
import static com.newsroom.common.JdbcTimestampUtils.toTimestamp;

import com.newsroom.newsletter.model.IdempotencyRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class IdempotencyRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Transactional(propagation = Propagation.MANDATORY)
  public int insertIfAbsent(UUID userId, String idempotencyKey, Instant createdAt) {
    // 同一キーの未コミット行がある場合、ここで相手の確定まで待たされる。
    // 1=予約成功、0=既存あり。
    final String sql =
        """
        INSERT INTO idempotency (
          user_id,
          idempotency_key,
          created_at
        ) VALUES (
          :userId,
          :idempotencyKey,
          :createdAt
        )
        ON CONFLICT DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("idempotencyKey", idempotencyKey)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<IdempotencyRecord> findByKey(UUID userId, String idempotencyKey) {
    final String sql =
        """
        SELECT user_id, idempotency_key, response_status_code,
               response_headers::text AS response_headers_text, response_body, created_at
        FROM idempotency
        WHERE user_id = :userId
          AND idempotency_key = :idempotencyKey
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("idempotencyKey", idempotencyKey);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public int saveResponse(
      UUID userId, String idempotencyKey, int statusCode, String headersJson, byte[] body) {
    final String sql =
        """
        UPDATE idempotency
        SET response_status_code = :statusCode,
            response_headers = :headersJson::jsonb,
            response_body = :body
        WHERE user_id = :userId
          AND idempotency_key = :idempotencyKey
          AND response_status_code IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("statusCode", statusCode)
            .addValue("headersJson", headersJson)
            .addValue("body", body)
            .addValue("userId", userId)
            .addValue("idempotencyKey", idempotencyKey);
    return jdbcTemplate.update(sql, params);
  }

  public int deleteCreatedBefore(Instant threshold) {
    final String sql =
        """
        DELETE FROM idempotency
        WHERE created_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  private IdempotencyRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final int statusCode = rs.getInt("response_status_code");
    return new IdempotencyRecord(
        UUID.fromString(rs.getString("user_id")),
        rs.getString("idempotency_key"),
        rs.wasNull() ? null : statusCode,
        rs.getString("response_headers_text"),
        rs.getBytes("response_body"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
