package com.chessmatch.arena.service;

import com.chessmatch.arena.model.MoveOutcome;

/**
 * chess-workers が返した status 文字列を着手結果へ分類する.
 *
 * <p>未知の status には {@link ChessWorkersIntegrationException} (INVALID_RESPONSE) を投げる.
 */
public interface MoveOutcomeClassifier {

  MoveOutcome classify(String workersStatus);
}
