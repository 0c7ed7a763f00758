/*
 * どこで: Newsletter サービス層
 * 何を: 購読確認/解除リンクに載せるトークンの生成と形式検証を行う
 * なぜ: 形式の崩れたトークンで DB を引かないようにするため
 */
package com.newsroom.newsletter.service;

import com.newsroom.newsletter.api.InvalidSubscriptionTokenException;
import java.security.SecureRandom;
import java.util.regex.Pattern;

public record SubscriptionToken(String value) {

    static final int LENGTH = 25;
    private static final String ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final Pattern FORMAT = Pattern.compile("^[A-Za-z0-9]{" + LENGTH + "}$");

    public static SubscriptionToken generate(SecureRandom random) {
        final StringBuilder builder = new StringBuilder(LENGTH);
        for (int i = 0; i < LENGTH; i++) {
            builder.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return new SubscriptionToken(builder.toString());
    }

    public static SubscriptionToken parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new InvalidSubscriptionTokenException("subscription_token is required");
        }
        if (!FORMAT.matcher(raw).matches()) {
            throw new InvalidSubscriptionTokenException("subscription_token is invalid");
        }
        return new SubscriptionToken(raw);
    }

    @Override
    public String toString() {
        return value;
    }
}
