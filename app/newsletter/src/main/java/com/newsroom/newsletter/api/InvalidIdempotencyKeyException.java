package com.newsroom.newsletter.api;

public class InvalidIdempotencyKeyException extends RuntimeException {

  public InvalidIdempotencyKeyException(String message) {
    super(message);
  }
}
