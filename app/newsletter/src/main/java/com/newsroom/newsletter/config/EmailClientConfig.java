/*
 * どこで: Newsletter アプリの設定
 * 何を: メール送信 API 向けの RestClient を組み立てる
 * なぜ: タイムアウトと接続先を送信クライアントから切り離すため
 */
package com.newsroom.newsletter.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@ConditionalOnProperty(
    name = "newsletter.email-client.mode",
    havingValue = EmailClientProperties.MODE_HTTP)
public class EmailClientConfig {

  @Bean
  RestClient emailRestClient(RestClient.Builder builder, EmailClientProperties properties) {
    // 送信 IO がワーカーを長時間塞がないよう接続/読み取りの両方に上限を付ける
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.timeout());
    requestFactory.setReadTimeout(properties.timeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
