package com.chessmatch.arena.api.request;

import com.chessmatch.arena.model.GameType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateInvitationRequest(
    @NotNull(message = "to_id is required") @Positive(message = "to_id must be positive") Long toId,
    GameType gameType) {

  public CreateInvitationRequest {
    gameType = gameType == null ? GameType.CHESS : gameType;
  }
}
