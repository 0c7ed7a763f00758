/*
 * どこで: Newsletter ドメインモデル
 * 何を: idempotency テーブルの 1 行を表す
 * なぜ: 処理中 (レスポンス未保存) と完了済みを呼び出し側で区別するため
 */
package com.newsroom.newsletter.model;

import java.time.Instant;
import java.util.UUID;

public record IdempotencyRecord(
    UUID userId,
    String idempotencyKey,
    Integer responseStatusCode,
    String responseHeadersJson,
    byte[] responseBody,
    Instant createdAt) {

  public IdempotencyRecord {
    // SpotBugs の EI_EXPOSE_REP 対応
    responseBody = responseBody == null ? null : responseBody.clone();
  }

  @Override
  public byte[] responseBody() {
    return responseBody == null ? null : responseBody.clone();
  }

  public boolean completed() {
    return responseStatusCode != null;
  }
}
