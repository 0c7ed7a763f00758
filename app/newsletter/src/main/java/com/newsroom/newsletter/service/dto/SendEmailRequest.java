package com.newsroom.newsletter.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

// 送信 API は PascalCase のキーを要求する
@JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
public record SendEmailRequest(
    String from, String to, String subject, String htmlBody, String textBody) {}
