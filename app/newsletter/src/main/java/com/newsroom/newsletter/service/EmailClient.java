/*
 * どこで: Newsletter サービス層
 * 何を: メール送信の抽象化インターフェース
 * なぜ: 実送信/ローカル/テスト差し替えを容易にするため
 */
package com.newsroom.newsletter.service;

public interface EmailClient {

    /**
     * 1 通送信する。送信できなかった場合は {@link EmailDeliveryException} などの実行時例外を投げ、
     * 呼び出し側は一時的失敗として扱う。
     */
    void sendEmail(String recipient, String subject, String htmlBody, String textBody);
}
