/*
 * どこで: Newsletter API
 * 何を: publish リクエストの入力を保持する
 * なぜ: JSON からのバインドを明確にし、検証はサービス側で順序どおり行うため
 */
package com.newsroom.newsletter.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PublishNewsletterRequest(
    String title, String htmlContent, String textContent, String idempotencyKey) {}
