package com.newsroom.newsletter.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConfirmSubscriptionResponse(
    UUID subscriberId, String email, String name, Instant subscribedAt, boolean newlyConfirmed) {}
