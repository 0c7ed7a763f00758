/*
 * どこで: Newsletter 配信ワーカー
 * 何を: 配信タスクの処理を自己再スケジュールで回し続ける
 * なぜ: キューの状態に応じて待機時間を変え、障害時も止まらずに配信を進めるため
 */
package com.newsroom.newsletter.service;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.newsroom.newsletter.config.NewsletterDeliveryProperties;
import com.newsroom.newsletter.model.ExecutionOutcome;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "newsletter.delivery.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class IssueDeliveryWorker {

  private static final Logger logger = LoggerFactory.getLogger(IssueDeliveryWorker.class);
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

  private final IssueDeliveryService deliveryService;
  private final DeliveryBackoffPolicy backoffPolicy;
  private final NewsletterDeliveryProperties properties;
  private final AtomicBoolean started;
  private volatile boolean stopping;
  private ScheduledExecutorService scheduler;

  public IssueDeliveryWorker(
      IssueDeliveryService deliveryService,
      DeliveryBackoffPolicy backoffPolicy,
      NewsletterDeliveryProperties properties) {
    this.deliveryService = deliveryService;
    this.backoffPolicy = backoffPolicy;
    this.properties = properties;
    this.started = new AtomicBoolean(false);
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    scheduler =
        Executors.newScheduledThreadPool(
            properties.workerCount(),
            new ThreadFactoryBuilder().setNameFormat("issue-delivery-%d").setDaemon(true).build());
    // ワーカーごとに独立した待機状態を持つ
    for (int i = 0; i < properties.workerCount(); i++) {
      scheduler.execute(() -> runLoop(backoffPolicy.initialPostponedDelay()));
    }
    logger.info("issue delivery worker started workerCount={}", properties.workerCount());
  }

  @PreDestroy
  public void stop() {
    stopping = true;
    if (scheduler == null) {
      return;
    }
    scheduler.shutdownNow();
    try {
      if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warn("issue delivery worker did not stop within {}", SHUTDOWN_TIMEOUT);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private void runLoop(Duration postponedDelay) {
    if (stopping) {
      return;
    }
    final DeliveryBackoffPolicy.BackoffStep step = runIteration(postponedDelay);
    try {
      scheduler.schedule(
          () -> runLoop(step.nextPostponedDelay()), step.sleep().toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      if (!stopping) {
        throw ex;
      }
    }
  }

  @VisibleForTesting
  DeliveryBackoffPolicy.BackoffStep runIteration(Duration postponedDelay) {
    try {
      final ExecutionOutcome outcome = deliveryService.tryExecuteTask();
      return backoffPolicy.afterOutcome(outcome, postponedDelay);
    } catch (RuntimeException ex) {
      // DB 障害などはループを止めずに一定時間待って再試行する
      final DeliveryBackoffPolicy.BackoffStep step = backoffPolicy.afterError();
      logger.warn("issue delivery iteration failed; retrying in {}", step.sleep(), ex);
      return step;
    } catch (Error err) {
      // ScheduledExecutorService は例外で終わったタスクを黙って捨てるため、ここで捕まえて再スケジュールする
      final DeliveryBackoffPolicy.BackoffStep step = backoffPolicy.afterError();
      logger.error("issue delivery iteration aborted by error; retrying in {}", step.sleep(), err);
      return step;
    }
  }
}
