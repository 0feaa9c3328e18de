/*
 * どこで: Arena API
 * 何を: 現在の状態では許されない遷移を表現する
 * なぜ: 現在状態をメッセージに含め、呼び出し側が再試行と競合を区別できるようにするため
 */
package com.chessmatch.arena.api;

public class StateConflictException extends RuntimeException {

  private final String currentState;

  public StateConflictException(String message, String currentState) {
    super(message);
    this.currentState = currentState;
  }

  public String currentState() {
    return currentState;
  }
}
