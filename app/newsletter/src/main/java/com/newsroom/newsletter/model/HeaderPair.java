package com.newsroom.newsletter.model;

public record HeaderPair(String name, String value) {}
