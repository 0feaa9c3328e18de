package com.chessmatch.arena.api;

public class InvalidCredentialsException extends RuntimeException {
  public InvalidCredentialsException() {
    super("invalid credentials");
  }
}
