/*
 * どこで: Newsletter サービス層
 * 何を: idempotency 予約の結果 (処理開始 or 保存済み応答の再送) を表す
 * なぜ: 呼び出し側が両ケースを取りこぼさず分岐できるようにするため
 */
package com.newsroom.newsletter.service;

import com.newsroom.newsletter.model.SavedHttpResponse;

public sealed interface NextAction permits NextAction.StartProcessing, NextAction.ReturnSavedResponse {

    /** 予約に成功した。トランザクションは開いたままで、レスポンス保存時に commit する。 */
    record StartProcessing(OpenTransaction transaction) implements NextAction {}

    /** 同じキーの処理が既に完了している。 */
    record ReturnSavedResponse(SavedHttpResponse response) implements NextAction {}
}
