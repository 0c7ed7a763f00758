/*
 * どこで: Newsletter サービス層
 * 何を: メール送信 API (POST /email) を呼び出してメールを送る
 * なぜ: 送信失敗の原因を分類し、配信ワーカーがリトライ判断できるようにするため
 */
package com.newsroom.newsletter.service;

import com.newsroom.newsletter.config.EmailClientProperties;
import com.newsroom.newsletter.service.dto.SendEmailRequest;
import java.net.SocketTimeoutException;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "newsletter.email-client.mode",
    havingValue = EmailClientProperties.MODE_HTTP)
public class HttpEmailClient implements EmailClient {

  private final RestClient emailRestClient;
  private final EmailClientProperties properties;

  @Override
  public void sendEmail(String recipient, String subject, String htmlBody, String textBody) {
    if (recipient == null || recipient.isBlank()) {
      throw new IllegalArgumentException("recipient is required");
    }
    final SendEmailRequest request =
        new SendEmailRequest(properties.sender(), recipient, subject, htmlBody, textBody);
    try {
      emailRestClient
          .post()
          .uri(properties.sendPath())
          .header(properties.tokenHeaderName(), properties.authorizationToken())
          .contentType(MediaType.APPLICATION_JSON)
          .body(request)
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    }
  }

  private EmailDeliveryException mapResponseException(RestClientResponseException ex) {
    if (ex.getStatusCode().is5xxServerError()) {
      return new EmailDeliveryException(
          EmailDeliveryException.Reason.SERVER_ERROR, "email api server error", ex);
    }
    return new EmailDeliveryException(
        EmailDeliveryException.Reason.REJECTED,
        "email api rejected request status=" + ex.getStatusCode().value(),
        ex);
  }

  private EmailDeliveryException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      return new EmailDeliveryException(
          EmailDeliveryException.Reason.TIMEOUT, "email api request timeout", ex);
    }
    return new EmailDeliveryException(
        EmailDeliveryException.Reason.CONNECTION_FAILED, "email api connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
