package com.newsroom.newsletter.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NewsletterIssueSummary(
    UUID issueId,
    String title,
    Instant publishedAt,
    int subscribersAtPublish,
    int deliveredCount,
    int failedCount) {}
