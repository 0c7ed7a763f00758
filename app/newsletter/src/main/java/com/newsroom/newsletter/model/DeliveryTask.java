/*
 * どこで: Newsletter ドメインモデル
 * 何を: issue_delivery_queue の 1 行 (issue x subscriber の未解決配信) を表す
 * なぜ: claim した配信の識別子とリトライ回数を明示的に受け渡すため
 */
package com.newsroom.newsletter.model;

import java.time.Instant;
import java.util.UUID;

public record DeliveryTask(UUID issueId, UUID subscriberId, int nRetries, Instant executeAfter) {}
