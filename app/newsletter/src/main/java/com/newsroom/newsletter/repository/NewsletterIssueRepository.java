/*
 * どこで: Newsletter データアクセス
 * 何を: newsletter_issues の登録/取得/配信カウンタ更新を担う
 * なぜ: issue 本文と配信結果の集計を 1 行で管理するため
 */
package com.newsroom.newsletter.repository;

import static com.newsroom.common.JdbcTimestampUtils.toInstant;
import static com.newsroom.common.JdbcTimestampUtils.toTimestamp;

import com.newsroom.newsletter.model.NewsletterIssueRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NewsletterIssueRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(NewsletterIssueRecord record) {
    final String sql =
        """
        INSERT INTO newsletter_issues (
          newsletter_issue_id,
          title,
          text_content,
          html_content,
          published_at,
          subscribers_at_publish,
          delivered_count,
          failed_count
        ) VALUES (
          :issueId,
          :title,
          :textContent,
          :htmlContent,
          :publishedAt,
          :subscribersAtPublish,
          :deliveredCount,
          :failedCount
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("issueId", record.issueId())
            .addValue("title", record.title())
            .addValue("textContent", record.textContent())
            .addValue("htmlContent", record.htmlContent())
            .addValue("publishedAt", toTimestamp(record.publishedAt()))
            .addValue("subscribersAtPublish", record.subscribersAtPublish())
            .addValue("deliveredCount", record.deliveredCount())
            .addValue("failedCount", record.failedCount());
    jdbcTemplate.update(sql, params);
    return record.issueId();
  }

  public Optional<NewsletterIssueRecord> findById(UUID issueId) {
    final String sql =
        """
        SELECT newsletter_issue_id, title, text_content, html_content, published_at,
               subscribers_at_publish, delivered_count, failed_count
        FROM newsletter_issues
        WHERE newsletter_issue_id = :issueId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("issueId", issueId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<NewsletterIssueRecord> findAll() {
    final String sql =
        """
        SELECT newsletter_issue_id, title, text_content, html_content, published_at,
               subscribers_at_publish, delivered_count, failed_count
        FROM newsletter_issues
        ORDER BY published_at DESC
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public int incrementDelivered(UUID issueId) {
    // 単一 UPDATE の行ロック下で加算し、並列ワーカー間の更新消失を防ぐ
    final String sql =
        """
        UPDATE newsletter_issues
        SET delivered_count = delivered_count + 1
        WHERE newsletter_issue_id = :issueId
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("issueId", issueId));
  }

  public int incrementFailed(UUID issueId) {
    final String sql =
        """
        UPDATE newsletter_issues
        SET failed_count = failed_count + 1
        WHERE newsletter_issue_id = :issueId
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("issueId", issueId));
  }

  private NewsletterIssueRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NewsletterIssueRecord(
        UUID.fromString(rs.getString("newsletter_issue_id")),
        rs.getString("title"),
        rs.getString("text_content"),
        rs.getString("html_content"),
        toInstant(rs.getTimestamp("published_at")),
        rs.getInt("subscribers_at_publish"),
        rs.getInt("delivered_count"),
        rs.getInt("failed_count"));
  }
}
