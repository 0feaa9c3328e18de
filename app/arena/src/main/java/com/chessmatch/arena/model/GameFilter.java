package com.chessmatch.arena.model;

public record GameFilter(
    Long id,
    Long invitationId,
    Long player1Id,
    Long player2Id,
    Long whomstId,
    Long winnerId,
    GameStatus status) {

  public static GameFilter byId(long id) {
    return new GameFilter(id, null, null, null, null, null, null);
  }
}
