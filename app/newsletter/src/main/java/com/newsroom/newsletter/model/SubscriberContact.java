/*
 * どこで: Newsletter ドメインモデル
 * 何を: 配信時に読み出す購読者の宛先情報と、その妥当性条件を表す
 * なぜ: 保存後に不正になった宛先を恒久的失敗として判定するため
 */
package com.newsroom.newsletter.model;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.UUID;

public record SubscriberContact(
    UUID subscriberId,
    @NotBlank @Email String email,
    @NotBlank @Size(max = 256) @Pattern(regexp = "[^/()\"<>\\\\{}]*") String name) {}
