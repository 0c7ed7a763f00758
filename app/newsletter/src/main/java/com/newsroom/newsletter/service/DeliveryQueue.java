/*
 * どこで: Newsletter 配信キュー
 * 何を: 実行可能な配信タスクを 1 件 claim し、行ロックを持ったまま呼び出し側へ渡す
 * なぜ: 送信から結果記録までを 1 トランザクションにし、同じ配信を他ワーカーに渡さないため
 */
package com.newsroom.newsletter.service;

import com.newsroom.newsletter.model.DeliveryTask;
import com.newsroom.newsletter.repository.DeliveryQueueRepository;
import com.newsroom.newsletter.repository.NewsletterIssueRepository;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;

@Component
@RequiredArgsConstructor
public class DeliveryQueue {

    private final DeliveryQueueRepository deliveryQueueRepository;
    private final NewsletterIssueRepository issueRepository;
    private final PlatformTransactionManager transactionManager;

    public Optional<ClaimedDeliveryTask> claimNext(Instant now) {
        final OpenTransaction transaction = OpenTransaction.begin(transactionManager);
        try {
            final Optional<DeliveryTask> task = deliveryQueueRepository.claimNextEligible(now);
            if (task.isEmpty()) {
                transaction.rollback();
                return Optional.empty();
            }
            return Optional.of(
                    new ClaimedDeliveryTask(task.get(), transaction, deliveryQueueRepository, issueRepository));
        } catch (RuntimeException ex) {
            transaction.close();
            throw ex;
        }
    }

    /** ロックを取らない件数。空キューと実行時刻未到来のタスクを区別するためだけに使う。 */
    public int countPending() {
        return deliveryQueueRepository.countAll();
    }
}
