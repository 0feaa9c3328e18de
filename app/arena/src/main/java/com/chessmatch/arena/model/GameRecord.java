/*
 * どこで: Arena ドメインモデル
 * 何を: 対局 1 件と、手番/勝者の導出を表現する
 * なぜ: player_1 を白、player_2 を黒とする割り当てをここに閉じ込めるため
 */
package com.chessmatch.arena.model;

import java.time.Instant;

public record GameRecord(
    long id,
    GameType gameType,
    long invitationId,
    Instant dateStarted,
    Instant dateEnded,
    long player1Id,
    String player1Name,
    long player2Id,
    String player2Name,
    long whomstId,
    Long winnerId,
    GameStatus status,
    String fen,
    String states) {

  public boolean isPlayer(long userId) {
    return player1Id == userId || player2Id == userId;
  }

  public boolean isWhite(long userId) {
    return player1Id == userId;
  }

  public long opponentOf(long userId) {
    return player1Id == userId ? player2Id : player1Id;
  }

  /** 終局状態に対応する勝者. 引き分けと進行中は null. */
  public Long winnerFor(GameStatus outcome) {
    return switch (outcome) {
      case WHITE_WINS -> player1Id;
      case BLACK_WINS -> player2Id;
      case ACTIVE, DRAW -> null;
    };
  }
}
