package com.newsroom.newsletter.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class NewsletterMetricsTest {

  @Test
  void recordsDeliveryPublishAndQueueMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final NewsletterMetrics metrics = new NewsletterMetrics(registry);

    metrics.recordDeliveryResult(NewsletterMetrics.RESULT_DELIVERED);
    metrics.recordDeliveryResult(NewsletterMetrics.RESULT_DELIVERED);
    metrics.recordDeliveryResult(NewsletterMetrics.RESULT_RETRY_SCHEDULED);
    metrics.recordPublishResult(NewsletterMetrics.RESULT_REPLAYED);
    metrics.recordSendAttempt();
    metrics.recordSendFailure("timeout");
    metrics.recordCleanupDeleted(3);
    metrics.recordCleanupDeleted(0);
    metrics.updateQueueCurrent(7);

    final Counter delivered =
        registry.get("newsletter.delivery.total").tag("result", "delivered").counter();
    final Counter retried =
        registry.get("newsletter.delivery.total").tag("result", "retry_scheduled").counter();
    final Counter replayed =
        registry.get("newsletter.publish.total").tag("result", "replayed").counter();
    final Counter attempts = registry.get("newsletter.email.send.attempts").counter();
    final Counter timeouts =
        registry.get("newsletter.email.send.failures").tag("reason", "timeout").counter();
    final Counter cleanup = registry.get("newsletter.idempotency.cleanup.deleted").counter();
    final Gauge queue = registry.get("newsletter.delivery.queue.current").gauge();

    assertThat(delivered.count()).isEqualTo(2.0d);
    assertThat(retried.count()).isEqualTo(1.0d);
    assertThat(replayed.count()).isEqualTo(1.0d);
    assertThat(attempts.count()).isEqualTo(1.0d);
    assertThat(timeouts.count()).isEqualTo(1.0d);
    assertThat(cleanup.count()).isEqualTo(3.0d);
    assertThat(queue.value()).isEqualTo(7.0d);
  }

  @Test
  void negativeQueueSizeIsClampedToZero() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final NewsletterMetrics metrics = new NewsletterMetrics(registry);

    metrics.updateQueueCurrent(-1);

    assertThat(registry.get("newsletter.delivery.queue.current").gauge().value()).isZero();
  }
}
