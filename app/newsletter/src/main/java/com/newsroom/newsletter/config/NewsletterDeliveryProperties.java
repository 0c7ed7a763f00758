/*
 * どこで: Newsletter アプリの設定バインド
 * 何を: 配信ワーカーの並列数/リトライ/待機時間の設定を保持する
 * なぜ: 運用パラメータを外部化し、不正値を起動時に弾くため
 */
package com.newsroom.newsletter.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "newsletter.delivery")
public record NewsletterDeliveryProperties(
    boolean enabled,
    @Min(1) int workerCount,
    @Min(0) @Max(255) int maxRetries,
    @NotNull Duration retryBackoff,
    @NotNull Duration emptyQueueDelay,
    @NotNull Duration errorDelay,
    @NotNull Duration postponedBackoffFloor,
    @Min(2) int postponedBackoffFactor,
    @NotNull Duration postponedBackoffCap) {}
