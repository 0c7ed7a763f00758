/*
 * どこで: Newsletter サービス層
 * 何を: メール送信を模擬する実装
 * なぜ: 外部送信を伴わずに配信キューの状態遷移を確認するため
 */
package com.newsroom.newsletter.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
        name = "newsletter.email-client.mode",
        havingValue = "local",
        matchIfMissing = true)
public class LocalEmailClient implements EmailClient {

    private static final Logger logger = LoggerFactory.getLogger(LocalEmailClient.class);

    @Override
    public void sendEmail(String recipient, String subject, String htmlBody, String textBody) {
        // 実送信は行わず、ログに残すだけとする
        logger.info("email simulated send recipient={} subject={} htmlLength={} textLength={}",
                recipient,
                subject,
                htmlBody.length(),
                textBody.length());
    }
}
