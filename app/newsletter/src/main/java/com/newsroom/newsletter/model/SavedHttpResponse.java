/*
 * どこで: Newsletter ドメインモデル
 * 何を: idempotency に保存する HTTP レスポンス (ステータス/ヘッダ/本文) を表す
 * なぜ: 再送時に最初の応答をバイト単位で同一に返すため
 */
package com.newsroom.newsletter.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public record SavedHttpResponse(int statusCode, List<HeaderPair> headers, byte[] body) {

  public SavedHttpResponse {
    headers =
        headers == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(headers));
    body = body == null ? new byte[0] : body.clone();
  }

  @Override
  public byte[] body() {
    return body.clone();
  }

  // 配列フィールドは参照比較になるため内容で比較する
  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof SavedHttpResponse that)) {
      return false;
    }
    return statusCode == that.statusCode
        && headers.equals(that.headers)
        && Arrays.equals(body, that.body);
  }

  @Override
  public int hashCode() {
    return Objects.hash(statusCode, headers, Arrays.hashCode(body));
  }

  @Override
  public String toString() {
    return "SavedHttpResponse[statusCode=" + statusCode + ", headers=" + headers
        + ", bodyLength=" + body.length + "]";
  }
}
