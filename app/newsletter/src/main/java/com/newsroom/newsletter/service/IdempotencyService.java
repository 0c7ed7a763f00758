/*
 * どこで: Newsletter サービス層
 * 何を: (user, idempotency key) 単位でリクエスト処理を予約し、完了時の応答を保存する
 * なぜ: 再送/同時送信された publish で issue とキューが重複しないようにするため
 */
package com.newsroom.newsletter.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.newsroom.newsletter.api.IdempotencyInProgressException;
import com.newsroom.newsletter.config.IdempotencyProperties;
import com.newsroom.newsletter.model.HeaderPair;
import com.newsroom.newsletter.model.IdempotencyRecord;
import com.newsroom.newsletter.model.SavedHttpResponse;
import com.newsroom.newsletter.repository.IdempotencyRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;

@Service
@RequiredArgsConstructor
public class IdempotencyService {

    private static final Logger logger = LoggerFactory.getLogger(IdempotencyService.class);
    private static final TypeReference<List<HeaderPair>> HEADER_LIST = new TypeReference<>() {};

    private final IdempotencyRepository idempotencyRepository;
    private final IdempotencyProperties properties;
    private final PlatformTransactionManager transactionManager;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public NextAction tryProcessing(UUID userId, IdempotencyKey key) {
        final OpenTransaction transaction = OpenTransaction.begin(transactionManager);
        final int inserted;
        try {
            inserted = idempotencyRepository.insertIfAbsent(userId, key.value(), Instant.now(clock));
        } catch (RuntimeException ex) {
            transaction.rollback();
            throw ex;
        }
        if (inserted > 0) {
            return new NextAction.StartProcessing(transaction);
        }
        // 先行リクエストが確定済み。予約用トランザクションは不要なので閉じる
        transaction.rollback();
        return new NextAction.ReturnSavedResponse(awaitSavedResponse(userId, key));
    }

    public SavedHttpResponse saveResponse(
            OpenTransaction transaction, UUID userId, IdempotencyKey key, SavedHttpResponse response) {
        final int updated = idempotencyRepository.saveResponse(
                userId,
                key.value(),
                response.statusCode(),
                writeHeaders(response.headers()),
                response.body());
        if (updated == 0) {
            // 予約行は同じトランザクションで挿入済みのため、0 件は不変条件違反
            throw new IllegalStateException("idempotency record missing while saving response");
        }
        transaction.commit();
        return response;
    }

    @VisibleForTesting
    SavedHttpResponse awaitSavedResponse(UUID userId, IdempotencyKey key) {
        final int attempts = properties.inProgressPollAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            final Optional<SavedHttpResponse> saved = findSavedResponse(userId, key);
            if (saved.isPresent()) {
                return saved.get();
            }
            if (attempt < attempts) {
                pause(properties.inProgressPollInterval());
            }
        }
        logger.warn("idempotent request still in progress userId={} idempotencyKey={} attempts={}",
                userId,
                key,
                attempts);
        throw new IdempotencyInProgressException(
                "a request with the same idempotency key is still in progress, try again later");
    }

    private Optional<SavedHttpResponse> findSavedResponse(UUID userId, IdempotencyKey key) {
        return idempotencyRepository.findByKey(userId, key.value())
                .filter(IdempotencyRecord::completed)
                .map(this::toSavedResponse);
    }

    private SavedHttpResponse toSavedResponse(IdempotencyRecord record) {
        return new SavedHttpResponse(
                record.responseStatusCode(),
                readHeaders(record.responseHeadersJson()),
                record.responseBody());
    }

    private String writeHeaders(List<HeaderPair> headers) {
        try {
            return objectMapper.writeValueAsString(headers);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to serialize idempotency response headers", ex);
        }
    }

    private List<HeaderPair> readHeaders(String headersJson) {
        if (headersJson == null) {
            return List.of();
        }
        try {
            return objectMapper.readValue(headersJson, HEADER_LIST);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to parse idempotency response headers", ex);
        }
    }

    private void pause(Duration interval) {
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IdempotencyInProgressException("interrupted while waiting for idempotent request");
        }
    }
}
