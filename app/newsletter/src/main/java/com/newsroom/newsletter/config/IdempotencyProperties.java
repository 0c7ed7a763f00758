/*
 * どこで: Newsletter アプリの設定バインド
 * 何を: idempotency レコードの保持期間と掃除/待機の設定を保持する
 * なぜ: 再送許容期間とテーブル肥大化のバランスを運用で調整するため
 */
package com.newsroom.newsletter.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "newsletter.idempotency")
public record IdempotencyProperties(
    @Min(1) long keyLifetimeMinutes,
    boolean cleanupEnabled,
    @NotNull Duration cleanupInterval,
    @Min(1) int inProgressPollAttempts,
    @NotNull Duration inProgressPollInterval) {}
