/*
 * どこで: 配信ワーカーの待機時間ポリシーのユニットテスト
 * 何を: 空キュー/未到来タスク/完了/障害ごとの待機時間と引き継ぎ値を検証する
 * なぜ: 待機時間の上限と初期化条件が崩れると DB を過剰にポーリングするため
 */
package com.newsroom.newsletter.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.newsroom.newsletter.config.NewsletterDeliveryProperties;
import com.newsroom.newsletter.model.ExecutionOutcome;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class DeliveryBackoffPolicyTest {

  private static final NewsletterDeliveryProperties PROPERTIES =
      new NewsletterDeliveryProperties(
          true,
          1,
          3,
          Duration.ofSeconds(30),
          Duration.ofSeconds(10),
          Duration.ofSeconds(1),
          Duration.ofMillis(10),
          10,
          Duration.ofSeconds(10));

  private final DeliveryBackoffPolicy policy = new DeliveryBackoffPolicy(PROPERTIES);

  @Test
  void postponedTasksSleepCurrentDelayAndGrowUntilCap() {
    Duration delay = policy.initialPostponedDelay();
    final Duration[] expectedSleeps = {
      Duration.ofMillis(10),
      Duration.ofMillis(100),
      Duration.ofSeconds(1),
      Duration.ofSeconds(10),
      Duration.ofSeconds(10)
    };

    for (Duration expected : expectedSleeps) {
      final DeliveryBackoffPolicy.BackoffStep step =
          policy.afterOutcome(ExecutionOutcome.POSTPONED_TASKS, delay);
      assertThat(step.sleep()).isEqualTo(expected);
      delay = step.nextPostponedDelay();
    }
    assertThat(delay).isEqualTo(Duration.ofSeconds(10));
  }

  @Test
  void emptyQueueSleepsFixedDelayAndResets() {
    final DeliveryBackoffPolicy.BackoffStep step =
        policy.afterOutcome(ExecutionOutcome.EMPTY_QUEUE, Duration.ofSeconds(1));

    assertThat(step.sleep()).isEqualTo(Duration.ofSeconds(10));
    assertThat(step.nextPostponedDelay()).isEqualTo(Duration.ofMillis(10));
  }

  @Test
  void completedTaskContinuesImmediatelyAndResets() {
    final DeliveryBackoffPolicy.BackoffStep step =
        policy.afterOutcome(ExecutionOutcome.TASK_COMPLETED, Duration.ofSeconds(10));

    assertThat(step.sleep()).isZero();
    assertThat(step.nextPostponedDelay()).isEqualTo(Duration.ofMillis(10));
  }

  @Test
  void errorSleepsFixedDelayAndResets() {
    final DeliveryBackoffPolicy.BackoffStep step = policy.afterError();

    assertThat(step.sleep()).isEqualTo(Duration.ofSeconds(1));
    assertThat(step.nextPostponedDelay()).isEqualTo(Duration.ofMillis(10));
  }
}
