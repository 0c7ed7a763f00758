/*
 * どこで: Newsletter データアクセス
 * 何を: subscriptions の登録/確認/削除と、配信対象と宛先の読み出しを行う
 * なぜ: 購読状態の遷移と publish/配信での参照を同じテーブル定義に揃えるため
 */
package com.newsroom.newsletter.repository;

import static com.newsroom.common.JdbcTimestampUtils.toInstant;
import static com.newsroom.common.JdbcTimestampUtils.toTimestamp;

import com.newsroom.newsletter.model.SubscriberContact;
import com.newsroom.newsletter.model.SubscriberRecord;
import java.time.Instant;
import java.util.List;
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
public class SubscriberRepository {

  public static final String STATUS_PENDING_CONFIRMATION = "pending_confirmation";
  public static final String STATUS_CONFIRMED = "confirmed";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<UUID> findConfirmedSubscriberIds() {
    final String sql =
        """
        SELECT id
        FROM subscriptions
        WHERE status = :status
        ORDER BY subscribed_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("status", STATUS_CONFIRMED);
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> UUID.fromString(rs.getString("id")));
  }

  public Optional<SubscriberContact> findContactById(UUID subscriberId) {
    final String sql =
        """
        SELECT id, email, name
        FROM subscriptions
        WHERE id = :subscriberId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("subscriberId", subscriberId);
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) ->
                new SubscriberContact(
                    UUID.fromString(rs.getString("id")),
                    rs.getString("email"),
                    rs.getString("name")))
        .stream()
        .findFirst();
  }

  /** email 重複時は {@link org.springframework.dao.DuplicateKeyException} を投げる。 */
  @Transactional(propagation = Propagation.MANDATORY)
  public void insertPending(UUID subscriberId, String email, String name, Instant subscribedAt) {
    final String sql =
        """
        INSERT INTO subscriptions (id, email, name, subscribed_at, status)
        VALUES (:subscriberId, :email, :name, :subscribedAt, :status)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("subscriberId", subscriberId)
            .addValue("email", email)
            .addValue("name", name)
            .addValue("subscribedAt", toTimestamp(subscribedAt))
            .addValue("status", STATUS_PENDING_CONFIRMATION);
    jdbcTemplate.update(sql, params);
  }

  public Optional<SubscriberRecord> findById(UUID subscriberId) {
    final String sql =
        """
        SELECT id, email, name, subscribed_at, status
        FROM subscriptions
        WHERE id = :subscriberId
        """;
    return findOne(sql, new MapSqlParameterSource().addValue("subscriberId", subscriberId));
  }

  public Optional<SubscriberRecord> findByEmail(String email) {
    final String sql =
        """
        SELECT id, email, name, subscribed_at, status
        FROM subscriptions
        WHERE email = :email
        """;
    return findOne(sql, new MapSqlParameterSource().addValue("email", email));
  }

  /** 確認待ちの行だけを confirmed に進める。既に確認済みなら 0 を返す。 */
  @Transactional(propagation = Propagation.MANDATORY)
  public int confirm(UUID subscriberId) {
    final String sql =
        """
        UPDATE subscriptions
        SET status = :confirmed
        WHERE id = :subscriberId
          AND status = :pending
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("subscriberId", subscriberId)
            .addValue("confirmed", STATUS_CONFIRMED)
            .addValue("pending", STATUS_PENDING_CONFIRMATION);
    return jdbcTemplate.update(sql, params);
  }

  /** トークンは FK の ON DELETE CASCADE で一緒に消える。 */
  @Transactional(propagation = Propagation.MANDATORY)
  public int delete(UUID subscriberId) {
    final String sql =
        """
        DELETE FROM subscriptions
        WHERE id = :subscriberId
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("subscriberId", subscriberId));
  }

  private Optional<SubscriberRecord> findOne(String sql, MapSqlParameterSource params) {
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) ->
                new SubscriberRecord(
                    UUID.fromString(rs.getString("id")),
                    rs.getString("email"),
                    rs.getString("name"),
                    toInstant(rs.getTimestamp("subscribed_at")),
                    rs.getString("status")))
        .stream()
        .findFirst();
  }
}
