/*
 * どこで: Newsletter idempotency 掃除ワーカー
 * 何を: idempotency 掃除をスケジュールで起動する
 * なぜ: 手動介入なしで期限切れキーを削除し続けるため
 */
package com.newsroom.newsletter.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "newsletter.idempotency.cleanup-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class IdempotencyKeyCleanupWorker {

  private static final Logger logger = LoggerFactory.getLogger(IdempotencyKeyCleanupWorker.class);

  private final IdempotencyKeyCleanupService cleanupService;

  @Scheduled(fixedDelayString = "${newsletter.idempotency.cleanup-interval}")
  public void run() {
    try {
      cleanupService.cleanup();
    } catch (DataAccessException ex) {
      // 次の周期で再試行する
      logger.warn("idempotency key cleanup failed", ex);
    }
  }
}
