/*
 * どこで: Newsletter 配信ワーカー
 * 何を: 1 周の結果から次の待機時間と、未到来タスク向け待機時間の次の値を決める
 * なぜ: 空キューや実行待ちタスクしかない間に DB をポーリングし続けないため
 */
package com.newsroom.newsletter.service;

import com.newsroom.newsletter.config.NewsletterDeliveryProperties;
import com.newsroom.newsletter.model.ExecutionOutcome;
import java.time.Duration;
import org.springframework.stereotype.Component;

@Component
public class DeliveryBackoffPolicy {

    /** 今回の待機時間と、次の周回へ引き継ぐ未到来タスク向け待機時間。 */
    public record BackoffStep(Duration sleep, Duration nextPostponedDelay) {}

    private final Duration emptyQueueDelay;
    private final Duration errorDelay;
    private final Duration postponedFloor;
    private final Duration postponedCap;
    private final int postponedFactor;

    public DeliveryBackoffPolicy(NewsletterDeliveryProperties properties) {
        this.emptyQueueDelay = properties.emptyQueueDelay();
        this.errorDelay = properties.errorDelay();
        this.postponedFloor = properties.postponedBackoffFloor();
        this.postponedCap = properties.postponedBackoffCap();
        this.postponedFactor = properties.postponedBackoffFactor();
    }

    public Duration initialPostponedDelay() {
        return postponedFloor;
    }

    public BackoffStep afterOutcome(ExecutionOutcome outcome, Duration currentPostponedDelay) {
        return switch (outcome) {
            case EMPTY_QUEUE -> new BackoffStep(emptyQueueDelay, postponedFloor);
            case POSTPONED_TASKS -> new BackoffStep(currentPostponedDelay, grow(currentPostponedDelay));
            case TASK_COMPLETED -> new BackoffStep(Duration.ZERO, postponedFloor);
        };
    }

    public BackoffStep afterError() {
        return new BackoffStep(errorDelay, postponedFloor);
    }

    private Duration grow(Duration current) {
        // 上限到達後は上限に張り付く
        if (current.compareTo(postponedCap) >= 0) {
            return postponedCap;
        }
        final Duration next = current.multipliedBy(postponedFactor);
        return next.compareTo(postponedCap) > 0 ? postponedCap : next;
    }
}
