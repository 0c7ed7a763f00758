/*
 * どこで: Newsletter idempotency 掃除サービス
 * 何を: 保持期間を過ぎた idempotency レコードを削除する
 * なぜ: 再送許容期間を過ぎたキーでテーブルが肥大化しないようにするため
 */
package com.newsroom.newsletter.service;

import com.newsroom.newsletter.config.IdempotencyProperties;
import com.newsroom.newsletter.repository.IdempotencyRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class IdempotencyKeyCleanupService {

  private static final Logger logger = LoggerFactory.getLogger(IdempotencyKeyCleanupService.class);

  private final IdempotencyRepository idempotencyRepository;
  private final IdempotencyProperties properties;
  private final NewsletterMetrics metrics;
  private final Clock clock;

  public int cleanup() {
    final Instant threshold =
        Instant.now(clock).minus(Duration.ofMinutes(properties.keyLifetimeMinutes()));
    final int deleted = idempotencyRepository.deleteCreatedBefore(threshold);
    metrics.recordCleanupDeleted(deleted);
    logger.info("idempotency key cleanup deleted={} threshold={}", deleted, threshold);
    return deleted;
  }
}
