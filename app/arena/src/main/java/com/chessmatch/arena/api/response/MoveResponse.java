package com.chessmatch.arena.api.response;

import com.chessmatch.arena.model.MoveRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MoveResponse(
    long id, long userId, long gameId, Instant timestamp, String movestr, String fen) {

  public static MoveResponse from(MoveRecord move) {
    return new MoveResponse(
        move.id(), move.userId(), move.gameId(), move.timestamp(), move.movestr(), move.fen());
  }
}
