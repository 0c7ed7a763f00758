package com.newsroom.newsletter.api;

public class InvalidSubscriptionTokenException extends RuntimeException {

  public InvalidSubscriptionTokenException(String message) {
    super(message);
  }
}
