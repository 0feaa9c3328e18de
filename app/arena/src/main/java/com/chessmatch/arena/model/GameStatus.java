/*
 * どこで: Arena ドメインモデル
 * 何を: 対局状態と遷移表を定義する
 * なぜ: 終局後の着手や二重終局を遷移表だけで拒否するため
 */
package com.chessmatch.arena.model;

import java.util.Optional;

public enum GameStatus {
  ACTIVE,
  DRAW,
  WHITE_WINS,
  BLACK_WINS;

  public boolean isTerminal() {
    return this != ACTIVE;
  }

  public Optional<GameStatus> transition(GameEvent event) {
    if (isTerminal()) {
      return Optional.empty();
    }
    return Optional.of(
        switch (event) {
          case MOVE_PLAYED -> ACTIVE;
          case WHITE_WON -> WHITE_WINS;
          case BLACK_WON -> BLACK_WINS;
          case DRAWN -> DRAW;
        });
  }
}
