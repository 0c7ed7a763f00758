package com.newsroom.newsletter.api;

public record SubscribeRequest(String email, String name) {}
