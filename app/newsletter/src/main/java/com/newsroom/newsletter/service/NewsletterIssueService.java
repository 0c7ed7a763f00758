/*
 * どこで: Newsletter サービス層
 * 何を: issue の登録と配信キューへの展開、配信状況の参照を担う
 * なぜ: issue 行と購読者ごとの配信タスクを同一トランザクションで作るため
 */
package com.newsroom.newsletter.service;

import com.newsroom.newsletter.api.IssueNotFoundException;
import com.newsroom.newsletter.api.NewsletterIssueDeliveryResponse;
import com.newsroom.newsletter.api.NewsletterIssueSummary;
import com.newsroom.newsletter.api.NewsletterIssuesResponse;
import com.newsroom.newsletter.model.EnqueuedIssue;
import com.newsroom.newsletter.model.NewsletterIssueRecord;
import com.newsroom.newsletter.repository.DeliveryQueueRepository;
import com.newsroom.newsletter.repository.NewsletterIssueRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class NewsletterIssueService {

    private final NewsletterIssueRepository issueRepository;
    private final DeliveryQueueRepository deliveryQueueRepository;
    private final Clock clock;

    /**
     * issue を登録し、購読者ごとに配信タスクを 1 件ずつ積む。
     *
     * <p>呼び出し側のトランザクションがあればそれに参加する。重複した購読者 ID は 1 件にまとめる。
     */
    @Transactional
    public EnqueuedIssue enqueueIssue(
            String title,
            String htmlContent,
            String textContent,
            Collection<UUID> confirmedSubscriberIds) {
        final Set<UUID> recipients = new LinkedHashSet<>(confirmedSubscriberIds);
        final Instant now = Instant.now(clock);
        final UUID issueId = UUID.randomUUID();
        issueRepository.insert(new NewsletterIssueRecord(
                issueId,
                title,
                textContent,
                htmlContent,
                now,
                recipients.size(),
                0,
                0));
        deliveryQueueRepository.enqueueAll(issueId, recipients, now);
        return new EnqueuedIssue(issueId, recipients.size());
    }

    public NewsletterIssuesResponse listIssues() {
        final List<NewsletterIssueSummary> items = issueRepository.findAll().stream()
                .map(this::toSummary)
                .toList();
        return new NewsletterIssuesResponse(items);
    }

    public NewsletterIssueDeliveryResponse getDeliveryOverview(UUID issueId) {
        final NewsletterIssueRecord record = issueRepository.findById(issueId)
                .orElseThrow(() -> new IssueNotFoundException("newsletter issue not found: " + issueId));
        return new NewsletterIssueDeliveryResponse(
                record.issueId(),
                record.title(),
                record.publishedAt(),
                record.subscribersAtPublish(),
                record.deliveredCount(),
                record.failedCount(),
                deliveryQueueRepository.countByIssue(issueId));
    }

    private NewsletterIssueSummary toSummary(NewsletterIssueRecord record) {
        return new NewsletterIssueSummary(
                record.issueId(),
                record.title(),
                record.publishedAt(),
                record.subscribersAtPublish(),
                record.deliveredCount(),
                record.failedCount());
    }
}
