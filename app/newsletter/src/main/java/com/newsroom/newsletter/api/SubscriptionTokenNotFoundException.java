package com.newsroom.newsletter.api;

public class SubscriptionTokenNotFoundException extends RuntimeException {

  public SubscriptionTokenNotFoundException(String message) {
    super(message);
  }
}
