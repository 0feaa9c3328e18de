/*
 * どこで: Arena サービス層
 * 何を: chess-workers 呼び出し失敗を表現する
 * なぜ: 不正手 (利用者起因) と下流障害 (サーバー起因) を API 層で別のステータスへ変換するため
 */
package com.chessmatch.arena.service;

public class ChessWorkersIntegrationException extends RuntimeException {

  public enum Reason {
    MOVE_REJECTED,
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public ChessWorkersIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public ChessWorkersIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  public boolean isClientError() {
    return reason == Reason.MOVE_REJECTED;
  }
}
