package com.chessmatch.arena.model;

/** chess-workers の応答を分類した着手結果. 勝敗は着手した側から見た値. */
public enum MoveOutcome {
  CONTINUES,
  MOVER_WINS,
  DRAW;

  public GameEvent toEvent(boolean moverIsWhite) {
    return switch (this) {
      case CONTINUES -> GameEvent.MOVE_PLAYED;
      case MOVER_WINS -> moverIsWhite ? GameEvent.WHITE_WON : GameEvent.BLACK_WON;
      case DRAW -> GameEvent.DRAWN;
    };
  }
}
