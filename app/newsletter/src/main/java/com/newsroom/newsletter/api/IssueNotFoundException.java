package com.newsroom.newsletter.api;

public class IssueNotFoundException extends RuntimeException {

  public IssueNotFoundException(String message) {
    super(message);
  }
}
