/*
 * どこで: Newsletter 配信サービス
 * 何を: 配信タスクを 1 件 claim して送信し、成功/恒久的失敗/リトライのいずれかを記録する
 * なぜ: 購読者ごとに配信結果がちょうど 1 回だけ集計されるようにするため
 */
package com.newsroom.newsletter.service;

import static net.logstash.logback.argument.StructuredArguments.kv;

import com.google.common.annotations.VisibleForTesting;
import com.newsroom.newsletter.config.NewsletterDeliveryProperties;
import com.newsroom.newsletter.model.DeliveryAttemptOutcome;
import com.newsroom.newsletter.model.DeliveryTask;
import com.newsroom.newsletter.model.ExecutionOutcome;
import com.newsroom.newsletter.model.NewsletterIssueRecord;
import com.newsroom.newsletter.model.SubscriberContact;
import com.newsroom.newsletter.repository.NewsletterIssueRepository;
import com.newsroom.newsletter.repository.SubscriberRepository;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class IssueDeliveryService {

    private static final Logger logger = LoggerFactory.getLogger(IssueDeliveryService.class);

    private final DeliveryQueue deliveryQueue;
    private final NewsletterIssueRepository issueRepository;
    private final SubscriberRepository subscriberRepository;
    private final EmailClient emailClient;
    private final Validator validator;
    private final NewsletterDeliveryProperties properties;
    private final NewsletterMetrics metrics;
    private final Clock clock;

    /**
     * 実行可能なタスクを 1 件処理する。
     *
     * <p>DB 障害などインフラ起因の例外はそのまま投げる。その場合 claim は rollback され、
     * タスクはリトライ回数を変えずに残る。
     */
    public ExecutionOutcome tryExecuteTask() {
        final Optional<ClaimedDeliveryTask> claimed = deliveryQueue.claimNext(Instant.now(clock));
        if (claimed.isEmpty()) {
            final int pending = deliveryQueue.countPending();
            metrics.updateQueueCurrent(pending);
            return pending == 0 ? ExecutionOutcome.EMPTY_QUEUE : ExecutionOutcome.POSTPONED_TASKS;
        }
        try (ClaimedDeliveryTask claim = claimed.get()) {
            final DeliveryAttemptOutcome outcome = attemptDelivery(claim.task());
            recordOutcome(claim, outcome);
        }
        // 処理中もキュー残量を追従させる
        metrics.updateQueueCurrent(deliveryQueue.countPending());
        return ExecutionOutcome.TASK_COMPLETED;
    }

    @VisibleForTesting
    DeliveryAttemptOutcome attemptDelivery(DeliveryTask task) {
        final NewsletterIssueRecord issue = issueRepository.findById(task.issueId())
                .orElseThrow(() -> new IllegalStateException("newsletter issue missing: " + task.issueId()));
        final Optional<SubscriberContact> contact = subscriberRepository.findContactById(task.subscriberId());
        if (contact.isEmpty()) {
            logger.error("skipping delivery, subscriber no longer exists {} {}",
                    kv("issue_id", task.issueId()),
                    kv("subscriber_id", task.subscriberId()));
            return DeliveryAttemptOutcome.PERMANENTLY_INVALID;
        }
        final Set<ConstraintViolation<SubscriberContact>> violations = validator.validate(contact.get());
        if (!violations.isEmpty()) {
            logger.error("skipping delivery, stored subscriber contact is invalid {} {} {}",
                    kv("issue_id", task.issueId()),
                    kv("subscriber_id", task.subscriberId()),
                    kv("invalid_fields", describe(violations)));
            return DeliveryAttemptOutcome.PERMANENTLY_INVALID;
        }
        metrics.recordSendAttempt();
        try {
            emailClient.sendEmail(contact.get().email(), issue.title(), issue.htmlContent(), issue.textContent());
            return DeliveryAttemptOutcome.DELIVERED;
        } catch (EmailDeliveryException ex) {
            metrics.recordSendFailure(ex.reason().name().toLowerCase(Locale.ROOT));
            logger.warn("email send failed {} {} {} {}",
                    kv("issue_id", task.issueId()),
                    kv("subscriber_id", task.subscriberId()),
                    kv("n_retries", task.nRetries()),
                    kv("reason", ex.reason()),
                    ex);
            return DeliveryAttemptOutcome.TRANSIENT_FAILURE;
        } catch (RuntimeException ex) {
            metrics.recordSendFailure(NewsletterMetrics.SEND_FAILURE_UNEXPECTED);
            logger.warn("email send failed {} {} {}",
                    kv("issue_id", task.issueId()),
                    kv("subscriber_id", task.subscriberId()),
                    kv("n_retries", task.nRetries()),
                    ex);
            return DeliveryAttemptOutcome.TRANSIENT_FAILURE;
        }
    }

    private void recordOutcome(ClaimedDeliveryTask claim, DeliveryAttemptOutcome outcome) {
        final DeliveryTask task = claim.task();
        switch (outcome) {
            case DELIVERED -> {
                claim.recordDelivered();
                metrics.recordDeliveryResult(NewsletterMetrics.RESULT_DELIVERED);
                logger.info("newsletter delivered {} {} {}",
                        kv("issue_id", task.issueId()),
                        kv("subscriber_id", task.subscriberId()),
                        kv("n_retries", task.nRetries()));
            }
            case PERMANENTLY_INVALID -> {
                claim.recordFailed();
                metrics.recordDeliveryResult(NewsletterMetrics.RESULT_FAILED_INVALID_CONTACT);
            }
            case TRANSIENT_FAILURE -> handleTransientFailure(claim);
        }
    }

    private void handleTransientFailure(ClaimedDeliveryTask claim) {
        final DeliveryTask task = claim.task();
        if (task.nRetries() < properties.maxRetries()) {
            final Instant executeAfter = Instant.now(clock).plus(properties.retryBackoff());
            claim.recordRetry(executeAfter);
            metrics.recordDeliveryResult(NewsletterMetrics.RESULT_RETRY_SCHEDULED);
            logger.warn("newsletter delivery retry scheduled {} {} {} {}",
                    kv("issue_id", task.issueId()),
                    kv("subscriber_id", task.subscriberId()),
                    kv("n_retries", task.nRetries() + 1),
                    kv("execute_after", executeAfter));
            return;
        }
        claim.recordFailed();
        metrics.recordDeliveryResult(NewsletterMetrics.RESULT_FAILED_RETRIES_EXHAUSTED);
        logger.error("newsletter delivery failed after retries {} {} {}",
                kv("issue_id", task.issueId()),
                kv("subscriber_id", task.subscriberId()),
                kv("n_retries", task.nRetries()));
    }

    private String describe(Set<ConstraintViolation<SubscriberContact>> violations) {
        return violations.stream()
                .map(violation -> violation.getPropertyPath().toString())
                .sorted()
                .distinct()
                .reduce((left, right) -> left + "," + right)
                .orElse("");
    }
}
