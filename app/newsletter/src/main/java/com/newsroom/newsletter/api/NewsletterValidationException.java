/*
 * どこで: Newsletter API
 * 何を: publish 入力の不備 (400) を表す例外を定義する
 * なぜ: 不足項目ごとに異なるコードとメッセージを返すため
 */
package com.newsroom.newsletter.api;

public class NewsletterValidationException extends RuntimeException {

  private final ApiErrorCode code;

  public NewsletterValidationException(ApiErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public ApiErrorCode code() {
    return code;
  }
}
