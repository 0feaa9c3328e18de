package com.chessmatch.arena.api;

/** 操作者が当事者ではない (招待の宛先/送信者、対局の参加者) ことを表す. */
public class ActionForbiddenException extends RuntimeException {
  public ActionForbiddenException(String message) {
    super(message);
  }
}
