/*
 * どこで: Arena 設定
 * 何を: chess-workers 呼び出し先 URL/パス/タイムアウトを保持する
 * なぜ: 下流の着手検証が応答しない場合も要求を有限時間で打ち切るため
 */
package com.chessmatch.arena.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "arena.workers")
public record ChessWorkersClientProperties(
    String baseUrl,
    String movePath,
    String suggestPath,
    Duration connectTimeout,
    Duration readTimeout) {

  public ChessWorkersClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://localhost:3000" : baseUrl;
    movePath = movePath == null || movePath.isBlank() ? "/move" : movePath;
    suggestPath = suggestPath == null || suggestPath.isBlank() ? "/suggest" : suggestPath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }
}
