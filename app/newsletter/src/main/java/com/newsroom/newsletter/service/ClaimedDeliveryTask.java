/*
 * どこで: Newsletter 配信キュー
 * 何を: claim 済みタスクと、その行ロックを保持するトランザクションの組を表す
 * なぜ: 1 つの claim に対して結果記録がちょうど 1 回だけ行われるようにするため
 */
package com.newsroom.newsletter.service;

import com.newsroom.newsletter.model.DeliveryTask;
import com.newsroom.newsletter.repository.DeliveryQueueRepository;
import com.newsroom.newsletter.repository.NewsletterIssueRepository;
import java.time.Instant;

/**
 * 所有権付きの claim。{@code recordDelivered}/{@code recordFailed}/{@code recordRetry} のどれか 1 つで
 * commit され、以降の操作は {@link IllegalStateException} になる。記録せずに {@link #close()} すると
 * rollback され、タスクはリトライ回数を変えずにキューへ戻る。
 */
public final class ClaimedDeliveryTask implements AutoCloseable {

    private final DeliveryTask task;
    private final OpenTransaction transaction;
    private final DeliveryQueueRepository deliveryQueueRepository;
    private final NewsletterIssueRepository issueRepository;

    ClaimedDeliveryTask(
            DeliveryTask task,
            OpenTransaction transaction,
            DeliveryQueueRepository deliveryQueueRepository,
            NewsletterIssueRepository issueRepository) {
        this.task = task;
        this.transaction = transaction;
        this.deliveryQueueRepository = deliveryQueueRepository;
        this.issueRepository = issueRepository;
    }

    public DeliveryTask task() {
        return task;
    }

    public void recordDelivered() {
        ensureOpen();
        issueRepository.incrementDelivered(task.issueId());
        deliveryQueueRepository.delete(task.issueId(), task.subscriberId());
        transaction.commit();
    }

    public void recordFailed() {
        ensureOpen();
        issueRepository.incrementFailed(task.issueId());
        deliveryQueueRepository.delete(task.issueId(), task.subscriberId());
        transaction.commit();
    }

    public void recordRetry(Instant executeAfter) {
        ensureOpen();
        deliveryQueueRepository.scheduleRetry(
                task.issueId(), task.subscriberId(), task.nRetries() + 1, executeAfter);
        transaction.commit();
    }

    public boolean isCompleted() {
        return transaction.isCompleted();
    }

    @Override
    public void close() {
        transaction.close();
    }

    private void ensureOpen() {
        if (transaction.isCompleted()) {
            throw new IllegalStateException(
                    "delivery task already resolved issueId=" + task.issueId()
                            + " subscriberId=" + task.subscriberId());
        }
    }
}
