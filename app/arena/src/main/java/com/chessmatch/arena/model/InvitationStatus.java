/*
 * どこで: Arena ドメインモデル
 * 何を: 招待の状態と遷移表を定義する
 * なぜ: PENDING からの一度きりの遷移をすべての API で同じ規則にするため
 */
package com.chessmatch.arena.model;

import java.util.Optional;

public enum InvitationStatus {
  PENDING,
  ACCEPTED,
  DECLINED,
  CANCELLED;

  public boolean isTerminal() {
    return this != PENDING;
  }

  /**
   * 遷移先を返す. 終端状態からはどのイベントも拒否され空を返す.
   */
  public Optional<InvitationStatus> transition(InvitationEvent event) {
    if (isTerminal()) {
      return Optional.empty();
    }
    return Optional.of(
        switch (event) {
          case ACCEPT -> ACCEPTED;
          case DECLINE -> DECLINED;
          case CANCEL -> CANCELLED;
        });
  }
}
