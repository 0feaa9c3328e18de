package com.chessmatch.arena.api.response;

import com.chessmatch.arena.model.GameRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GameResponse(
    long id,
    String gameType,
    long invitationId,
    Instant dateStarted,
    Instant dateEnded,
    @JsonProperty("player_1") long player1,
    @JsonProperty("player_1_name") String player1Name,
    @JsonProperty("player_2") long player2,
    @JsonProperty("player_2_name") String player2Name,
    long whomst,
    Long winner,
    String status,
    String fen,
    @JsonRawValue String states) {

  public static GameResponse from(GameRecord game) {
    return new GameResponse(
        game.id(),
        game.gameType().name(),
        game.invitationId(),
        game.dateStarted(),
        game.dateEnded(),
        game.player1Id(),
        game.player1Name(),
        game.player2Id(),
        game.player2Name(),
        game.whomstId(),
        game.winnerId(),
        game.status().name(),
        game.fen(),
        game.states());
  }
}
