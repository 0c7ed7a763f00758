/*
 * どこで: 配信サービスのユニットテスト
 * 何を: claim 結果ごとの分岐と、成功/恒久的失敗/リトライの記録内容を検証する
 * なぜ: 購読者ごとの配信結果が 1 回だけ集計されることを DB なしで担保するため
 */
package com.newsroom.newsletter.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.newsroom.newsletter.config.NewsletterDeliveryProperties;
import com.newsroom.newsletter.model.DeliveryTask;
import com.newsroom.newsletter.model.ExecutionOutcome;
import com.newsroom.newsletter.model.NewsletterIssueRecord;
import com.newsroom.newsletter.model.SubscriberContact;
import com.newsroom.newsletter.repository.DeliveryQueueRepository;
import com.newsroom.newsletter.repository.NewsletterIssueRepository;
import com.newsroom.newsletter.repository.SubscriberRepository;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class IssueDeliveryServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T00:00:00Z");
  private static final UUID ISSUE_ID = UUID.fromString("00000000-0000-0000-0000-00000000a001");
  private static final UUID SUBSCRIBER_ID = UUID.fromString("00000000-0000-0000-0000-00000000b001");
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
  private static final NewsletterIssueRecord ISSUE =
      new NewsletterIssueRecord(ISSUE_ID, "Weekly", "plain body", "<p>html body</p>", FIXED_NOW, 1, 0, 0);

  private static ValidatorFactory validatorFactory;

  @Mock private DeliveryQueue deliveryQueue;
  @Mock private DeliveryQueueRepository deliveryQueueRepository;
  @Mock private NewsletterIssueRepository issueRepository;
  @Mock private SubscriberRepository subscriberRepository;
  @Mock private EmailClient emailClient;
  @Mock private NewsletterMetrics metrics;

  private RecordingTransactionManager transactionManager;
  private IssueDeliveryService service;

  @BeforeAll
  static void setUpValidator() {
    validatorFactory = Validation.buildDefaultValidatorFactory();
  }

  @AfterAll
  static void closeValidator() {
    validatorFactory.close();
  }

  @BeforeEach
  void setUp() {
    final Validator validator = validatorFactory.getValidator();
    transactionManager = new RecordingTransactionManager();
    service =
        new IssueDeliveryService(
            deliveryQueue,
            issueRepository,
            subscriberRepository,
            emailClient,
            validator,
            PROPERTIES,
            metrics,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void returnsEmptyQueueWhenNothingIsPending() {
    when(deliveryQueue.claimNext(FIXED_NOW)).thenReturn(Optional.empty());
    when(deliveryQueue.countPending()).thenReturn(0);

    assertThat(service.tryExecuteTask()).isEqualTo(ExecutionOutcome.EMPTY_QUEUE);
    verify(metrics).updateQueueCurrent(0);
    verifyNoInteractions(emailClient);
  }

  @Test
  void returnsPostponedWhenOnlyFutureTasksRemain() {
    // 実行時刻未到来のタスクだけが残っている状態
    when(deliveryQueue.claimNext(FIXED_NOW)).thenReturn(Optional.empty());
    when(deliveryQueue.countPending()).thenReturn(2);

    assertThat(service.tryExecuteTask()).isEqualTo(ExecutionOutcome.POSTPONED_TASKS);
    verifyNoInteractions(emailClient);
  }

  @Test
  void deliversAndRemovesTask() {
    givenClaim(0);
    givenContact("ann@example.com", "Ann");
    when(deliveryQueue.countPending()).thenReturn(4);

    assertThat(service.tryExecuteTask()).isEqualTo(ExecutionOutcome.TASK_COMPLETED);

    verify(emailClient).sendEmail("ann@example.com", "Weekly", "<p>html body</p>", "plain body");
    verify(issueRepository).incrementDelivered(ISSUE_ID);
    verify(deliveryQueueRepository).delete(ISSUE_ID, SUBSCRIBER_ID);
    verify(issueRepository, never()).incrementFailed(any());
    verify(metrics).recordDeliveryResult(NewsletterMetrics.RESULT_DELIVERED);
    // キューが空になる前でもゲージは最新の残量を示す
    verify(metrics).updateQueueCurrent(4);
    assertThat(transactionManager.commits).isEqualTo(1);
  }

  @Test
  void invalidStoredEmailIsPermanentFailureWithoutSending() {
    givenClaim(0);
    givenContact("not-an-email", "Ann");

    service.tryExecuteTask();

    verifyNoInteractions(emailClient);
    verify(issueRepository).incrementFailed(ISSUE_ID);
    verify(deliveryQueueRepository).delete(ISSUE_ID, SUBSCRIBER_ID);
    verify(metrics).recordDeliveryResult(NewsletterMetrics.RESULT_FAILED_INVALID_CONTACT);
  }

  @Test
  void invalidStoredNameIsPermanentFailure() {
    givenClaim(0);
    givenContact("ann@example.com", "Ann <script>");

    service.tryExecuteTask();

    verifyNoInteractions(emailClient);
    verify(issueRepository).incrementFailed(ISSUE_ID);
  }

  @Test
  void missingSubscriberIsPermanentFailure() {
    givenClaim(0);
    when(issueRepository.findById(ISSUE_ID)).thenReturn(Optional.of(ISSUE));
    when(subscriberRepository.findContactById(SUBSCRIBER_ID)).thenReturn(Optional.empty());

    service.tryExecuteTask();

    verifyNoInteractions(emailClient);
    verify(issueRepository).incrementFailed(ISSUE_ID);
    verify(deliveryQueueRepository).delete(ISSUE_ID, SUBSCRIBER_ID);
  }

  @Test
  void transientFailureSchedulesRetryWhileRetriesRemain() {
    givenClaim(1);
    givenContact("ann@example.com", "Ann");
    doThrow(new EmailDeliveryException(EmailDeliveryException.Reason.TIMEOUT, "timeout"))
        .when(emailClient)
        .sendEmail(any(), any(), any(), any());

    service.tryExecuteTask();

    // リトライ回数を 1 つ進め、now + retry-backoff に再実行する
    verify(deliveryQueueRepository)
        .scheduleRetry(ISSUE_ID, SUBSCRIBER_ID, 2, FIXED_NOW.plus(PROPERTIES.retryBackoff()));
    verify(deliveryQueueRepository, never()).delete(any(), any());
    verify(issueRepository, never()).incrementFailed(any());
    verify(issueRepository, never()).incrementDelivered(any());
    verify(metrics).recordDeliveryResult(NewsletterMetrics.RESULT_RETRY_SCHEDULED);
    verify(metrics).recordSendFailure("timeout");
    assertThat(transactionManager.commits).isEqualTo(1);
  }

  @Test
  void rejectedSendIsRecordedWithItsReason() {
    givenClaim(0);
    givenContact("ann@example.com", "Ann");
    doThrow(new EmailDeliveryException(EmailDeliveryException.Reason.REJECTED, "422 from provider"))
        .when(emailClient)
        .sendEmail(any(), any(), any(), any());

    service.tryExecuteTask();

    verify(metrics).recordSendFailure("rejected");
    verify(metrics, never()).recordSendFailure(NewsletterMetrics.SEND_FAILURE_UNEXPECTED);
    verify(deliveryQueueRepository)
        .scheduleRetry(ISSUE_ID, SUBSCRIBER_ID, 1, FIXED_NOW.plus(PROPERTIES.retryBackoff()));
  }

  @Test
  void transientFailureAtRetryLimitIsCountedAsFailed() {
    givenClaim(PROPERTIES.maxRetries());
    givenContact("ann@example.com", "Ann");
    doThrow(new IllegalStateException("smtp down"))
        .when(emailClient)
        .sendEmail(any(), any(), any(), any());

    service.tryExecuteTask();

    verify(deliveryQueueRepository, never()).scheduleRetry(any(), any(), anyInt(), any());
    verify(issueRepository).incrementFailed(ISSUE_ID);
    verify(deliveryQueueRepository).delete(ISSUE_ID, SUBSCRIBER_ID);
    verify(metrics).recordDeliveryResult(NewsletterMetrics.RESULT_FAILED_RETRIES_EXHAUSTED);
    verify(metrics).recordSendFailure(NewsletterMetrics.SEND_FAILURE_UNEXPECTED);
  }

  @Test
  void infrastructureFailureWhileRecordingRollsBackClaim() {
    givenClaim(0);
    givenContact("ann@example.com", "Ann");
    when(deliveryQueueRepository.delete(ISSUE_ID, SUBSCRIBER_ID))
        .thenThrow(new DataAccessResourceFailureException("connection lost"));

    assertThatThrownBy(() -> service.tryExecuteTask())
        .isInstanceOf(DataAccessResourceFailureException.class);

    // commit されないので、タスクはリトライ回数を変えずに残る
    assertThat(transactionManager.commits).isZero();
    assertThat(transactionManager.rollbacks).isEqualTo(1);
  }

  private void givenClaim(int nRetries) {
    final DeliveryTask task = new DeliveryTask(ISSUE_ID, SUBSCRIBER_ID, nRetries, FIXED_NOW);
    final ClaimedDeliveryTask claim =
        new ClaimedDeliveryTask(
            task,
            OpenTransaction.begin(transactionManager),
            deliveryQueueRepository,
            issueRepository);
    when(deliveryQueue.claimNext(FIXED_NOW)).thenReturn(Optional.of(claim));
  }

  private void givenContact(String email, String name) {
    when(issueRepository.findById(ISSUE_ID)).thenReturn(Optional.of(ISSUE));
    when(subscriberRepository.findContactById(SUBSCRIBER_ID))
        .thenReturn(Optional.of(new SubscriberContact(SUBSCRIBER_ID, email, name)));
  }
}
