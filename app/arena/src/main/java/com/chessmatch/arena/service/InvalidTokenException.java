package com.chessmatch.arena.service;

public class InvalidTokenException extends RuntimeException {

  public enum Reason {
    MALFORMED,
    EXPIRED
  }

  private final Reason reason;

  public InvalidTokenException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
