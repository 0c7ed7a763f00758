/*
 * どこで: Newsletter ドメインモデル
 * 何を: 1 件の配信試行の結果を定義する
 * なぜ: 成功/恒久的失敗/一時的失敗で後続の記録処理を分けるため
 */
package com.newsroom.newsletter.model;

public enum DeliveryAttemptOutcome {
    DELIVERED,
    PERMANENTLY_INVALID,
    TRANSIENT_FAILURE
}
