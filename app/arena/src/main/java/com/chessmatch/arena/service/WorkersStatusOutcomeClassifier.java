/*
 * どこで: Arena サービス層
 * 何を: chess-workers の status を継続/着手側勝利/引き分けへ対応付ける
 * なぜ: ステイルメイト等の扱いを着手処理から切り離して差し替え可能にするため
 */
package com.chessmatch.arena.service;

import com.chessmatch.arena.model.MoveOutcome;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class WorkersStatusOutcomeClassifier implements MoveOutcomeClassifier {

  private static final Map<String, MoveOutcome> OUTCOMES =
      Map.ofEntries(
          Map.entry("MOVEOK", MoveOutcome.CONTINUES),
          Map.entry("ACTIVE", MoveOutcome.CONTINUES),
          Map.entry("CHECK", MoveOutcome.CONTINUES),
          Map.entry("GAMEOVER", MoveOutcome.MOVER_WINS),
          Map.entry("CHECKMATE", MoveOutcome.MOVER_WINS),
          Map.entry("DRAW", MoveOutcome.DRAW),
          Map.entry("STALEMATE", MoveOutcome.DRAW),
          Map.entry("INSUFFICIENT_MATERIAL", MoveOutcome.DRAW),
          Map.entry("THREEFOLD_REPETITION", MoveOutcome.DRAW),
          Map.entry("FIFTY_MOVE_RULE", MoveOutcome.DRAW));

  @Override
  public MoveOutcome classify(String workersStatus) {
    final MoveOutcome outcome =
        workersStatus == null ? null : OUTCOMES.get(workersStatus.trim().toUpperCase(Locale.ROOT));
    if (outcome == null) {
      throw new ChessWorkersIntegrationException(
          ChessWorkersIntegrationException.Reason.INVALID_RESPONSE,
          "unknown chess-workers status: " + workersStatus);
    }
    return outcome;
  }
}
