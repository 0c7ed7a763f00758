/*
 * どこで: Newsletter アプリの設定バインド
 * 何を: メール送信クライアントの接続先/送信元/タイムアウトを保持する
 * なぜ: ローカル実行と実送信を設定だけで切り替えるため
 */
package com.newsroom.newsletter.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "newsletter.email-client")
public record EmailClientProperties(
    String mode,
    String baseUrl,
    String sender,
    String authorizationToken,
    String tokenHeaderName,
    String sendPath,
    Duration timeout) {

  public static final String MODE_LOCAL = "local";
  public static final String MODE_HTTP = "http";

  public EmailClientProperties {
    mode = mode == null || mode.isBlank() ? MODE_LOCAL : mode;
    baseUrl = baseUrl == null ? "http://localhost:8025" : baseUrl;
    sender = sender == null || sender.isBlank() ? "newsletter@localhost" : sender;
    authorizationToken = authorizationToken == null ? "" : authorizationToken;
    tokenHeaderName =
        tokenHeaderName == null || tokenHeaderName.isBlank()
            ? "X-Postmark-Server-Token"
            : tokenHeaderName;
    sendPath = sendPath == null || sendPath.isBlank() ? "/email" : sendPath;
    timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
  }
}
