package com.chessmatch.arena.model;

import java.time.Instant;

/** 招待 1 件. 送信者/受信者名は論理削除済みユーザーでも解決される. */
public record InvitationRecord(
    long id,
    Instant dateSent,
    Instant dateAnswered,
    long fromId,
    String fromName,
    long toId,
    String toName,
    GameType gameType,
    InvitationStatus status) {

  public long participant(InvitationEvent.Party party) {
    return party == InvitationEvent.Party.SENDER ? fromId : toId;
  }
}
