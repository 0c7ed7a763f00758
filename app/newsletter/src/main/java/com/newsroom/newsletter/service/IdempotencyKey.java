/*
 * どこで: Newsletter サービス層
 * 何を: publish リクエストの idempotency key を検証済みの値として表す
 * なぜ: UUID 以外のキーをストレージに触れる前に弾くため
 */
package com.newsroom.newsletter.service;

import com.newsroom.newsletter.api.InvalidIdempotencyKeyException;
import java.util.Locale;
import java.util.regex.Pattern;

public record IdempotencyKey(String value) {

    private static final Pattern HYPHENATED =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final Pattern SIMPLE = Pattern.compile("^[0-9a-fA-F]{32}$");

    public static IdempotencyKey parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidIdempotencyKeyException("idempotency_key is required");
        }
        // 桁区切りは 8-4-4-4-12 固定。UUID.fromString の寛容な解析には頼らない
        if (HYPHENATED.matcher(raw).matches()) {
            return new IdempotencyKey(raw.toLowerCase(Locale.ROOT));
        }
        if (SIMPLE.matcher(raw).matches()) {
            final String hex = raw.toLowerCase(Locale.ROOT);
            return new IdempotencyKey(hex.substring(0, 8) + "-" + hex.substring(8, 12) + "-"
                    + hex.substring(12, 16) + "-" + hex.substring(16, 20) + "-" + hex.substring(20));
        }
        throw new InvalidIdempotencyKeyException("idempotency_key must be a UUID");
    }

    @Override
    public String toString() {
        return value;
    }
}
