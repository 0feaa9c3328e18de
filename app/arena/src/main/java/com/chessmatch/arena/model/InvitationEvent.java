/*
 * どこで: Arena ドメインモデル
 * 何を: 招待に対する操作と、その操作が要求する当事者/前提を定義する
 * なぜ: accept/decline/cancel の認可規則を 1 か所で持つため
 */
package com.chessmatch.arena.model;

public enum InvitationEvent {
  ACCEPT(Party.RECIPIENT, true),
  DECLINE(Party.RECIPIENT, true),
  CANCEL(Party.SENDER, false);

  /** 招待のどちら側が操作できるか. */
  public enum Party {
    SENDER,
    RECIPIENT
  }

  private final Party actor;
  private final boolean requiresLiveSender;

  InvitationEvent(Party actor, boolean requiresLiveSender) {
    this.actor = actor;
    this.requiresLiveSender = requiresLiveSender;
  }

  public Party actor() {
    return actor;
  }

  public boolean requiresLiveSender() {
    return requiresLiveSender;
  }
}
