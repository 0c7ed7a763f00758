/*
 * どこで: Newsletter API
 * 何を: issue の publish と配信状況参照のエンドポイントを提供する
 * なぜ: 管理者向けの公開インターフェースを明確にするため
 */
package com.newsroom.newsletter.api;

import com.newsroom.newsletter.model.HeaderPair;
import com.newsroom.newsletter.model.SavedHttpResponse;
import com.newsroom.newsletter.service.NewsletterIssueService;
import com.newsroom.newsletter.service.NewsletterPublishService;

import lombok.RequiredArgsConstructor;

import java.util.UUID;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/newsletters")
@RequiredArgsConstructor
public class NewsletterController {

    // 認証済みユーザーの ID は上流ゲートウェイが付与する
    static final String HEADER_USER_ID = "X-User-Id";
    private static final String HEADER_TRACE_ID = "X-Trace-Id";

    private final NewsletterPublishService publishService;
    private final NewsletterIssueService issueService;

    @PostMapping
    public ResponseEntity<byte[]> publish(
            @RequestHeader(HEADER_USER_ID) UUID userId,
            @RequestHeader(value = HEADER_TRACE_ID, required = false) String traceId,
            @RequestBody PublishNewsletterRequest request) {
        return toResponseEntity(publishService.publish(userId, request, traceId));
    }

    @GetMapping
    public NewsletterIssuesResponse list() {
        return issueService.listIssues();
    }

    @GetMapping("/{issue_id}")
    public NewsletterIssueDeliveryResponse get(@PathVariable("issue_id") UUID issueId) {
        return issueService.getDeliveryOverview(issueId);
    }

    private ResponseEntity<byte[]> toResponseEntity(SavedHttpResponse saved) {
        // 保存済みのステータス/ヘッダ/本文をそのまま返し、再送時も同一の応答にする
        final HttpHeaders headers = new HttpHeaders();
        for (HeaderPair header : saved.headers()) {
            headers.add(header.name(), header.value());
        }
        return ResponseEntity.status(saved.statusCode()).headers(headers).body(saved.body());
    }
}
