/*
 * どこで: Arena API
 * 何を: 対象 (招待/対局/ユーザー) の未検出を表現する
 * なぜ: 認可や状態検査より先に 404 として返すため
 */
package com.chessmatch.arena.api;

public class ResourceNotFoundException extends RuntimeException {
  public ResourceNotFoundException(String message) {
    super(message);
  }
}
