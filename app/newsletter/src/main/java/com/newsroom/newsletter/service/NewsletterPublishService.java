/*
 * どこで: Newsletter サービス層
 * 何を: publish リクエストを検証し、idempotency 予約の下で issue 登録と配信展開を行う
 * なぜ: 同じ送信が何度届いても配信は 1 回分だけ積み、同一の応答を返すため
 */
package com.newsroom.newsletter.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsroom.common.TraceIds;
import com.newsroom.newsletter.api.ApiErrorCode;
import com.newsroom.newsletter.api.NewsletterValidationException;
import com.newsroom.newsletter.api.PublishNewsletterRequest;
import com.newsroom.newsletter.api.PublishNewsletterResponse;
import com.newsroom.newsletter.model.EnqueuedIssue;
import com.newsroom.newsletter.model.HeaderPair;
import com.newsroom.newsletter.model.SavedHttpResponse;
import com.newsroom.newsletter.repository.SubscriberRepository;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NewsletterPublishService {

    static final String ACCEPTED_MESSAGE =
            "The newsletter issue has been accepted - emails will go out shortly.";
    static final String ISSUE_LOCATION_PREFIX = "/admin/newsletters/";

    private static final Logger logger = LoggerFactory.getLogger(NewsletterPublishService.class);

    private final IdempotencyService idempotencyService;
    private final NewsletterIssueService issueService;
    private final SubscriberRepository subscriberRepository;
    private final NewsletterMetrics metrics;
    private final ObjectMapper objectMapper;

    public SavedHttpResponse publish(UUID userId, PublishNewsletterRequest request, String traceId) {
        final String resolvedTraceId = TraceIds.resolve(traceId);
        validate(request);
        final IdempotencyKey key = IdempotencyKey.parse(request.idempotencyKey());

        final NextAction next = idempotencyService.tryProcessing(userId, key);
        if (next instanceof NextAction.ReturnSavedResponse saved) {
            metrics.recordPublishResult(NewsletterMetrics.RESULT_REPLAYED);
            logger.info("newsletter publish replayed userId={} idempotencyKey={} traceId={}",
                    userId,
                    key,
                    resolvedTraceId);
            return saved.response();
        }
        final NextAction.StartProcessing start = (NextAction.StartProcessing) next;
        // 例外で抜けた場合は close で rollback され、予約行も issue も残らない
        try (OpenTransaction transaction = start.transaction()) {
            final List<UUID> subscriberIds = subscriberRepository.findConfirmedSubscriberIds();
            final EnqueuedIssue issue = issueService.enqueueIssue(
                    request.title(),
                    request.htmlContent(),
                    request.textContent(),
                    subscriberIds);
            final SavedHttpResponse response = idempotencyService.saveResponse(
                    transaction,
                    userId,
                    key,
                    buildAcceptedResponse(issue));
            metrics.recordPublishResult(NewsletterMetrics.RESULT_ACCEPTED);
            logger.info("newsletter issue accepted issueId={} subscribersAtPublish={} userId={} traceId={}",
                    issue.issueId(),
                    issue.subscribersAtPublish(),
                    userId,
                    resolvedTraceId);
            return response;
        }
    }

    private void validate(PublishNewsletterRequest request) {
        if (isBlank(request.title())) {
            throw new NewsletterValidationException(
                    ApiErrorCode.TITLE_REQUIRED, "You must set a title for your newsletter.");
        }
        if (isBlank(request.htmlContent())) {
            throw new NewsletterValidationException(
                    ApiErrorCode.HTML_CONTENT_REQUIRED, "You must set html content for your newsletter.");
        }
        if (isBlank(request.textContent())) {
            throw new NewsletterValidationException(
                    ApiErrorCode.TEXT_CONTENT_REQUIRED, "You must set text content for your newsletter.");
        }
    }

    private SavedHttpResponse buildAcceptedResponse(EnqueuedIssue issue) {
        final PublishNewsletterResponse body = new PublishNewsletterResponse(
                issue.issueId(),
                issue.subscribersAtPublish(),
                ACCEPTED_MESSAGE);
        try {
            return new SavedHttpResponse(
                    HttpStatus.SEE_OTHER.value(),
                    List.of(
                            new HeaderPair(HttpHeaders.LOCATION, ISSUE_LOCATION_PREFIX + issue.issueId()),
                            new HeaderPair(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)),
                    objectMapper.writeValueAsBytes(body));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to serialize publish response", ex);
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
