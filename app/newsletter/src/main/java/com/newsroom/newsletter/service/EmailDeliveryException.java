package com.newsroom.newsletter.service;

public class EmailDeliveryException extends RuntimeException {

  public enum Reason {
    REJECTED,
    SERVER_ERROR,
    TIMEOUT,
    CONNECTION_FAILED
  }

  private final Reason reason;

  public EmailDeliveryException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public EmailDeliveryException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
