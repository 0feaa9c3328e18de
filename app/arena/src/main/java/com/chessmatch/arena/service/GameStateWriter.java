/*
 * どこで: Arena サービス層
 * 何を: 検証済みの着手/投了を 1 トランザクションで確定させる
 * なぜ: chess-workers 呼び出しをトランザクション外に置き、確定処理だけを短く保つため
 */
package com.chessmatch.arena.service;

import com.chessmatch.arena.api.StateConflictException;
import com.chessmatch.arena.model.GameEvent;
import com.chessmatch.arena.model.GameRecord;
import com.chessmatch.arena.model.GameStatus;
import com.chessmatch.arena.model.MoveOutcome;
import com.chessmatch.arena.repository.GameMoveUpdate;
import com.chessmatch.arena.repository.GameRepository;
import com.chessmatch.arena.repository.MoveRepository;
import com.chessmatch.arena.repository.UserRepository;
import com.chessmatch.arena.service.dto.MoveResult;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class GameStateWriter {

  private static final Logger logger = LoggerFactory.getLogger(GameStateWriter.class);

  private final GameRepository gameRepository;
  private final MoveRepository moveRepository;
  private final UserRepository userRepository;
  private final Clock clock;

  /**
   * 読み込んだ時点の game から盤面が進んでいないことを条件に着手を反映し、着手履歴を追記する.
   *
   * @throws StateConflictException 検証中に他の要求が対局を更新していた場合
   */
  @Transactional
  public GameRecord commitMove(
      GameRecord game, long moverId, String move, MoveResult result, MoveOutcome outcome) {
    final GameStatus next = nextStatus(game, outcome.toEvent(game.isWhite(moverId)));
    final Instant now = clock.instant();
    final GameMoveUpdate update =
        new GameMoveUpdate(
            game.id(),
            moverId,
            game.fen(),
            result.fen(),
            result.states(),
            game.opponentOf(moverId),
            next,
            game.winnerFor(next),
            next.isTerminal() ? now : null);
    final GameRecord updated =
        gameRepository
            .applyMove(update)
            .orElseThrow(
                () ->
                    new StateConflictException(
                        "game with ID '" + game.id() + "' changed while the move was validated",
                        "STALE_BOARD"));
    moveRepository.insert(moverId, game.id(), now, move, result.fen());
    if (next.isTerminal()) {
      recordResult(updated);
    }
    return updated;
  }

  /** 投了. 相手側を勝者として終局させる. */
  @Transactional
  public GameRecord commitForfeit(GameRecord game, long forfeitingId) {
    final long winnerId = game.opponentOf(forfeitingId);
    final GameStatus next =
        nextStatus(game, game.isWhite(winnerId) ? GameEvent.WHITE_WON : GameEvent.BLACK_WON);
    final GameRecord updated =
        gameRepository
            .finishIfActive(game.id(), next, winnerId, clock.instant())
            .orElseThrow(
                () ->
                    new StateConflictException(
                        "game with ID '" + game.id() + "' is no longer active", "NOT_ACTIVE"));
    recordResult(updated);
    return updated;
  }

  private GameStatus nextStatus(GameRecord game, GameEvent event) {
    return game.status()
        .transition(event)
        .orElseThrow(
            () ->
                new StateConflictException(
                    "game with ID '" + game.id() + "' already has '" + game.status() + "' status",
                    game.status().name()));
  }

  private void recordResult(GameRecord finished) {
    if (finished.winnerId() == null) {
      userRepository.addResult(finished.player1Id(), 0, 1, 0);
      userRepository.addResult(finished.player2Id(), 0, 1, 0);
    } else {
      final long winnerId = finished.winnerId();
      userRepository.addResult(winnerId, 1, 0, 0);
      userRepository.addResult(finished.opponentOf(winnerId), 0, 0, 1);
    }
    logger.info(
        "game finished gameId={} status={} winner={}",
        finished.id(),
        finished.status(),
        finished.winnerId());
  }
}
