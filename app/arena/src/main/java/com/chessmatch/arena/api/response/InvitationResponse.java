package com.chessmatch.arena.api.response;

import com.chessmatch.arena.model.InvitationRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InvitationResponse(
    long id,
    Instant dateSent,
    Instant dateAnswered,
    long fromId,
    String fromName,
    long toId,
    String toName,
    String gameType,
    String status) {

  public static InvitationResponse from(InvitationRecord invitation) {
    return new InvitationResponse(
        invitation.id(),
        invitation.dateSent(),
        invitation.dateAnswered(),
        invitation.fromId(),
        invitation.fromName(),
        invitation.toId(),
        invitation.toName(),
        invitation.gameType().name(),
        invitation.status().name());
  }
}
