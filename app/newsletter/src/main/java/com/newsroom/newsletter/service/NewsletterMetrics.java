/*
 * どこで: Newsletter サービス層
 * 何を: 配信結果/送信試行と失敗理由/キュー残量/publish 結果/idempotency 掃除件数のメトリクスを記録する
 * なぜ: 配信の滞留や失敗の増加を Prometheus から直接観測できるようにするため
 */
package com.newsroom.newsletter.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NewsletterMetrics {

  static final String RESULT_DELIVERED = "delivered";
  static final String RESULT_RETRY_SCHEDULED = "retry_scheduled";
  static final String RESULT_FAILED_INVALID_CONTACT = "failed_invalid_contact";
  static final String RESULT_FAILED_RETRIES_EXHAUSTED = "failed_retries_exhausted";
  static final String RESULT_ACCEPTED = "accepted";
  static final String RESULT_REPLAYED = "replayed";
  static final String SEND_FAILURE_UNEXPECTED = "unexpected";

  private static final String METRIC_DELIVERY_TOTAL = "newsletter.delivery.total";
  private static final String METRIC_EMAIL_SEND_ATTEMPTS = "newsletter.email.send.attempts";
  private static final String METRIC_EMAIL_SEND_FAILURES = "newsletter.email.send.failures";
  private static final String METRIC_QUEUE_CURRENT = "newsletter.delivery.queue.current";
  private static final String METRIC_PUBLISH_TOTAL = "newsletter.publish.total";
  private static final String METRIC_CLEANUP_DELETED = "newsletter.idempotency.cleanup.deleted";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger queueCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> publishCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> sendFailureCounters = new ConcurrentHashMap<>();
  private final Counter sendAttemptCounter;
  private final Counter cleanupDeletedCounter;

  public NewsletterMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_QUEUE_CURRENT, queueCurrent, AtomicInteger::get)
        .description("Pending issue delivery tasks seen by the last poll")
        .register(meterRegistry);
    this.sendAttemptCounter =
        Counter.builder(METRIC_EMAIL_SEND_ATTEMPTS)
            .description("Total number of email send attempts")
            .register(meterRegistry);
    this.cleanupDeletedCounter =
        Counter.builder(METRIC_CLEANUP_DELETED)
            .description("Total number of idempotency records removed by cleanup")
            .register(meterRegistry);
  }

  public void recordDeliveryResult(String result) {
    deliveryCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Issue delivery outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordPublishResult(String result) {
    publishCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_PUBLISH_TOTAL)
                    .description("Publish request outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordSendAttempt() {
    sendAttemptCounter.increment();
  }

  public void recordSendFailure(String reason) {
    sendFailureCounters
        .computeIfAbsent(
            reason,
            ignored ->
                Counter.builder(METRIC_EMAIL_SEND_FAILURES)
                    .description("Failed email send attempts by reason")
                    .tags(Tags.of("reason", reason))
                    .register(meterRegistry))
        .increment();
  }

  public void recordCleanupDeleted(int deleted) {
    if (deleted > 0) {
      cleanupDeletedCounter.increment(deleted);
    }
  }

  public void updateQueueCurrent(int pending) {
    queueCurrent.set(Math.max(pending, 0));
  }
}
