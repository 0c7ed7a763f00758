/*
 * どこで: Newsletter API
 * 何を: 同じ idempotency key の先行リクエストが未完了 (409) であることを表す
 * なぜ: クライアントに二重実行ではなく再試行を促すため
 */
package com.newsroom.newsletter.api;

public class IdempotencyInProgressException extends RuntimeException {

  public IdempotencyInProgressException(String message) {
    super(message);
  }
}
