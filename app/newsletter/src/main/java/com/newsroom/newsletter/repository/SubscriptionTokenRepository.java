/*
 * どこで: Newsletter データアクセス
 * 何を: subscription_tokens の登録と、トークン/購読者 ID の相互参照を行う
 * なぜ: 確認リンクと解除リンクから購読者を特定するため
 */
package com.newsroom.newsletter.repository;

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
public class SubscriptionTokenRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 購読者行と同じトランザクションで呼ぶ。 */
  @Transactional(propagation = Propagation.MANDATORY)
  public void insert(String subscriptionToken, UUID subscriberId) {
    final String sql =
        """
        INSERT INTO subscription_tokens (subscription_token, subscriber_id)
        VALUES (:subscriptionToken, :subscriberId)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("subscriptionToken", subscriptionToken)
            .addValue("subscriberId", subscriberId);
    jdbcTemplate.update(sql, params);
  }

  public Optional<UUID> findSubscriberId(String subscriptionToken) {
    final String sql =
        """
        SELECT subscriber_id
        FROM subscription_tokens
        WHERE subscription_token = :subscriptionToken
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("subscriptionToken", subscriptionToken);
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> UUID.fromString(rs.getString("subscriber_id")))
        .stream()
        .findFirst();
  }

  public Optional<String> findTokenBySubscriberId(UUID subscriberId) {
    final String sql =
        """
        SELECT subscription_token
        FROM subscription_tokens
        WHERE subscriber_id = :subscriberId
        LIMIT 1
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("subscriberId", subscriberId);
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> rs.getString("subscription_token"))
        .stream()
        .findFirst();
  }
}
