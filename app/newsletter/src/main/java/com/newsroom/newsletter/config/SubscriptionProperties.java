/*
 * どこで: Newsletter アプリの設定バインド
 * 何を: 購読確認リンクの組み立てに使う公開 URL を保持する
 * なぜ: 環境ごとに確認メールのリンク先を切り替えるため
 */
package com.newsroom.newsletter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "newsletter.subscription")
public record SubscriptionProperties(String baseUrl) {

  public SubscriptionProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://localhost:8080" : baseUrl;
    // リンク組み立て時に "//" にならないよう末尾の / を落とす
    while (baseUrl.endsWith("/")) {
      baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
    }
  }
}
