/*
 * どこで: Newsletter データアクセス
 * 何を: issue_delivery_queue の登録/claim/削除/リトライ更新を担う
 * なぜ: 複数ワーカー・複数プロセスで同じ配信を二重に処理しないため
 */
package com.newsroom.newsletter.repository;

import static com.newsroom.common.JdbcTimestampUtils.toInstant;
import static com.newsroom.common.JdbcTimestampUtils.toTimestamp;

import com.newsroom.newsletter.model.DeliveryTask;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class DeliveryQueueRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int enqueueAll(UUID issueId, Collection<UUID> subscriberIds, Instant executeAfter) {
    if (subscriberIds.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        INSERT INTO issue_delivery_queue (
          newsletter_issue_id,
          subscriber_id,
          n_retries,
          execute_after
        ) VALUES (
          :issueId,
          :subscriberId,
          0,
          :executeAfter
        )
        """;
    final SqlParameterSource[] batch =
        subscriberIds.stream()
            .map(
                subscriberId ->
                    new MapSqlParameterSource()
                        .addValue("issueId", issueId)
                        .addValue("subscriberId", subscriberId)
                        .addValue("executeAfter", toTimestamp(executeAfter)))
            .toArray(SqlParameterSource[]::new);
    return Arrays.stream(jdbcTemplate.batchUpdate(sql, batch)).map(count -> Math.max(count, 0)).sum();
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public Optional<DeliveryTask> claimNextEligible(Instant now) {
    // 他ワーカーがロック中の行は読み飛ばし、待たずに別の行を取る。
    // ロックは呼び出し側のトランザクション終了まで保持される。
    final String sql =
        """
        SELECT newsletter_issue_id, subscriber_id, n_retries, execute_after
        FROM issue_delivery_queue
        WHERE execute_after <= :now
        ORDER BY execute_after
        LIMIT 1
        FOR UPDATE SKIP LOCKED
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int countAll() {
    // ロックは取らない。空キューと未到来タスクの区別にだけ使う
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM issue_delivery_queue", new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  public int countByIssue(UUID issueId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM issue_delivery_queue
        WHERE newsletter_issue_id = :issueId
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("issueId", issueId), Integer.class);
    return count == null ? 0 : count;
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public int delete(UUID issueId, UUID subscriberId) {
    final String sql =
        """
        DELETE FROM issue_delivery_queue
        WHERE newsletter_issue_id = :issueId
          AND subscriber_id = :subscriberId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("issueId", issueId)
            .addValue("subscriberId", subscriberId);
    return jdbcTemplate.update(sql, params);
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public int scheduleRetry(UUID issueId, UUID subscriberId, int nRetries, Instant executeAfter) {
    final String sql =
        """
        UPDATE issue_delivery_queue
        SET n_retries = :nRetries,
            execute_after = :executeAfter
        WHERE newsletter_issue_id = :issueId
          AND subscriber_id = :subscriberId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("nRetries", nRetries)
            .addValue("executeAfter", toTimestamp(executeAfter))
            .addValue("issueId", issueId)
            .addValue("subscriberId", subscriberId);
    return jdbcTemplate.update(sql, params);
  }

  private DeliveryTask mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DeliveryTask(
        UUID.fromString(rs.getString("newsletter_issue_id")),
        UUID.fromString(rs.getString("subscriber_id")),
        rs.getInt("n_retries"),
        toInstant(rs.getTimestamp("execute_after")));
  }
}
