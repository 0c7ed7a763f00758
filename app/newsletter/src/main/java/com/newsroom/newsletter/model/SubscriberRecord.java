package com.newsroom.newsletter.model;

import java.time.Instant;
import java.util.UUID;

public record SubscriberRecord(
    UUID subscriberId, String email, String name, Instant subscribedAt, String status) {}
