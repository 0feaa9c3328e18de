package com.chessmatch.arena.api;

public class NotYourTurnException extends StateConflictException {
  public NotYourTurnException(long userId) {
    super("it is not the turn of user with id '" + userId + "'", "NOT_YOUR_TURN");
  }
}
