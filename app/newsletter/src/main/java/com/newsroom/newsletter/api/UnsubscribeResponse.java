package com.newsroom.newsletter.api;

public record UnsubscribeResponse(String email, String name) {}
