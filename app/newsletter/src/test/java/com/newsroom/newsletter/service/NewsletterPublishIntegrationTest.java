/*
 * どこで: Newsletter publish の統合テスト
 * 何を: 再送/同時送信/キー形式不正/別ユーザーでの publish を Postgres 上で検証する
 * なぜ: idempotency の予約と issue 作成が実 DB のロックで直列化されることを確認するため
 */
package com.newsroom.newsletter.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.newsroom.newsletter.AbstractPostgresContainerTest;
import com.newsroom.newsletter.NewsletterTestData;
import com.newsroom.newsletter.api.IdempotencyInProgressException;
import com.newsroom.newsletter.api.InvalidIdempotencyKeyException;
import com.newsroom.newsletter.api.NewsletterIssueSummary;
import com.newsroom.newsletter.api.PublishNewsletterRequest;
import com.newsroom.newsletter.model.SavedHttpResponse;
import com.newsroom.newsletter.repository.DeliveryQueueRepository;
import com.newsroom.newsletter.repository.IdempotencyRepository;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@ActiveProfiles("test")
class NewsletterPublishIntegrationTest extends AbstractPostgresContainerTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-0000000000c1");
    private static final String KEY = "7d444840-9dc0-11d1-b245-5ffdce74fad2";

    @Autowired
    private NewsletterPublishService publishService;

    @Autowired
    private NewsletterIssueService issueService;

    @Autowired
    private DeliveryQueueRepository deliveryQueueRepository;

    @Autowired
    private IdempotencyRepository idempotencyRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private NamedParameterJdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanup() {
        NewsletterTestData.truncateAll(jdbcTemplate);
    }

    @Test
    void retriedPublishReturnsIdenticalResponseAndCreatesOneIssue() {
        NewsletterTestData.insertConfirmedSubscriber(jdbcTemplate, "ann@example.com");
        NewsletterTestData.insertConfirmedSubscriber(jdbcTemplate, "bob@example.com");

        final SavedHttpResponse first = publishService.publish(USER_ID, request(KEY), null);
        final SavedHttpResponse second = publishService.publish(USER_ID, request(KEY), null);

        assertThat(first.statusCode()).isEqualTo(303);
        assertThat(second).isEqualTo(first);
        final List<NewsletterIssueSummary> issues = issueService.listIssues().issues();
        assertThat(issues).hasSize(1);
        assertThat(issues.get(0).subscribersAtPublish()).isEqualTo(2);
        assertThat(deliveryQueueRepository.countByIssue(issues.get(0).issueId())).isEqualTo(2);
    }

    @Test
    void concurrentPublishesWithSameKeyCreateOneIssue() throws Exception {
        NewsletterTestData.insertConfirmedSubscriber(jdbcTemplate, "ann@example.com");
        NewsletterTestData.insertConfirmedSubscriber(jdbcTemplate, "bob@example.com");
        NewsletterTestData.insertConfirmedSubscriber(jdbcTemplate, "cat@example.com");

        final CountDownLatch startGate = new CountDownLatch(1);
        final Callable<SavedHttpResponse> publish = () -> {
            startGate.await();
            return publishService.publish(USER_ID, request(KEY), null);
        };
        final ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            final Future<SavedHttpResponse> first = executor.submit(publish);
            final Future<SavedHttpResponse> second = executor.submit(publish);
            startGate.countDown();

            assertThat(first.get(30, TimeUnit.SECONDS)).isEqualTo(second.get(30, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        final List<NewsletterIssueSummary> issues = issueService.listIssues().issues();
        assertThat(issues).hasSize(1);
        assertThat(deliveryQueueRepository.countAll()).isEqualTo(3);
    }

    @Test
    void malformedKeyLeavesNoIdempotencyRecord() {
        assertThatThrownBy(() -> publishService.publish(USER_ID, request("not-a-uuid"), null))
                .isInstanceOf(InvalidIdempotencyKeyException.class);

        assertThat(countRows("idempotency")).isZero();
        assertThat(countRows("newsletter_issues")).isZero();
    }

    @Test
    void sameKeyFromAnotherUserPublishesSeparately() {
        NewsletterTestData.insertConfirmedSubscriber(jdbcTemplate, "ann@example.com");

        final SavedHttpResponse mine = publishService.publish(USER_ID, request(KEY), null);
        final SavedHttpResponse theirs = publishService.publish(UUID.randomUUID(), request(KEY), null);

        assertThat(theirs).isNotEqualTo(mine);
        assertThat(issueService.listIssues().issues()).hasSize(2);
    }

    @Test
    void onlyConfirmedSubscribersAreEnqueued() {
        NewsletterTestData.insertConfirmedSubscriber(jdbcTemplate, "ann@example.com");
        NewsletterTestData.insertSubscriber(jdbcTemplate, "pending@example.com", "Pending", "pending_confirmation");

        publishService.publish(USER_ID, request(KEY), null);

        final NewsletterIssueSummary issue = issueService.listIssues().issues().get(0);
        assertThat(issue.subscribersAtPublish()).isEqualTo(1);
        assertThat(deliveryQueueRepository.countByIssue(issue.issueId())).isEqualTo(1);
    }

    @Test
    void unresolvedReservationIsReportedAsInProgress() {
        // 応答保存前に落ちた先行リクエストを模して、未完了の予約行だけを残す
        new TransactionTemplate(transactionManager).executeWithoutResult(
                status -> idempotencyRepository.insertIfAbsent(USER_ID, KEY, Instant.now()));

        assertThatThrownBy(() -> publishService.publish(USER_ID, request(KEY), null))
                .isInstanceOf(IdempotencyInProgressException.class);
        assertThat(countRows("newsletter_issues")).isZero();
    }

    private PublishNewsletterRequest request(String key) {
        return new PublishNewsletterRequest("Weekly", "<p>hi</p>", "hi", key);
    }

    private int countRows(String table) {
        final Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + table, new MapSqlParameterSource(), Integer.class);
        return count == null ? 0 : count;
    }
}
