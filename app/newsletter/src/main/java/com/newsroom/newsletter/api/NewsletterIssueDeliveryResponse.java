/*
 * どこで: Newsletter API
 * 何を: 1 issue の配信状況 (成功/失敗/未解決件数) を表す
 * なぜ: 配信がどこまで進んだかを運用者が確認できるようにするため
 */
package com.newsroom.newsletter.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NewsletterIssueDeliveryResponse(
    UUID issueId,
    String title,
    Instant publishedAt,
    int subscribersAtPublish,
    int deliveredCount,
    int failedCount,
    int pendingDeliveries) {}
