/*
 * どこで: Arena API
 * 何を: name/email の重複登録を表現する
 * なぜ: DB の一意制約違反を 400 応答へ変換するため
 */
package com.chessmatch.arena.api;

public class DuplicateIdentityException extends RuntimeException {
  public DuplicateIdentityException(String message, Throwable cause) {
    super(message, cause);
  }
}
