/*
 * どこで: Newsletter ドメインモデル
 * 何を: newsletter_issues テーブルのスナップショット
 * なぜ: 配信ワーカーと参照 API で共通化するため
 */
package com.newsroom.newsletter.model;

import java.time.Instant;
import java.util.UUID;

public record NewsletterIssueRecord(
        UUID issueId,
        String title,
        String textContent,
        String htmlContent,
        Instant publishedAt,
        int subscribersAtPublish,
        int deliveredCount,
        int failedCount) {
}
