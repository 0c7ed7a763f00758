/*
 * どこで: Newsletter API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.newsroom.newsletter.api;

public enum ApiErrorCode {
    BAD_REQUEST,
    TITLE_REQUIRED,
    HTML_CONTENT_REQUIRED,
    TEXT_CONTENT_REQUIRED,
    INVALID_IDEMPOTENCY_KEY,
    IDEMPOTENCY_REQUEST_IN_PROGRESS,
    ISSUE_NOT_FOUND,
    INVALID_SUBSCRIBER,
    INVALID_SUBSCRIPTION_TOKEN,
    UNKNOWN_SUBSCRIPTION_TOKEN,
    CONFIRMATION_EMAIL_FAILED
}
