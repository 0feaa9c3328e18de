/*
 * どこで: Arena サービス層
 * 何を: 着手/投了/着手提案と対局・着手履歴の一覧を提供する
 * なぜ: 手番と参加者の検査をここで行い、合法手判定は chess-workers へ委譲するため
 */
package com.chessmatch.arena.service;

import com.chessmatch.arena.api.ActionForbiddenException;
import com.chessmatch.arena.api.NotYourTurnException;
import com.chessmatch.arena.api.ResourceNotFoundException;
import com.chessmatch.arena.api.StateConflictException;
import com.chessmatch.arena.model.GameFilter;
import com.chessmatch.arena.model.GameRecord;
import com.chessmatch.arena.model.MoveFilter;
import com.chessmatch.arena.model.MoveOutcome;
import com.chessmatch.arena.model.MoveRecord;
import com.chessmatch.arena.model.PageSpec;
import com.chessmatch.arena.repository.GameRepository;
import com.chessmatch.arena.repository.MoveRepository;
import com.chessmatch.arena.service.dto.MoveResult;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class GameService {

  public static final String INITIAL_FEN =
      "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";
  public static final String INITIAL_STATES = "{}";

  private static final Logger logger = LoggerFactory.getLogger(GameService.class);

  private final GameRepository gameRepository;
  private final MoveRepository moveRepository;
  private final ChessWorkersClient chessWorkersClient;
  private final MoveOutcomeClassifier outcomeClassifier;
  private final GameStateWriter gameStateWriter;
  private final ArenaMetrics metrics;

  /**
   * 着手する. chess-workers の検証はトランザクション外で行い、結果の確定だけを短い
   * トランザクションで行う. 検証に失敗した場合、対局は変更されない.
   */
  public GameRecord move(long gameId, long actorId, String move) {
    final GameRecord game = requirePlayableBy(gameId, actorId);
    final MoveResult result;
    final MoveOutcome outcome;
    try {
      result = chessWorkersClient.move(game.fen(), move, game.states());
      outcome = outcomeClassifier.classify(result.status());
    } catch (ChessWorkersIntegrationException ex) {
      metrics.recordMove(ex.isClientError() ? "rejected" : "error");
      throw ex;
    }
    final GameRecord updated = gameStateWriter.commitMove(game, actorId, move, result, outcome);
    metrics.recordMove(updated.status().isTerminal() ? "finished" : "accepted");
    logger.info(
        "move accepted gameId={} userId={} move={} status={}",
        gameId,
        actorId,
        move,
        updated.status());
    return updated;
  }

  public GameRecord forfeit(long gameId, long actorId) {
    final GameRecord game = requireGame(gameId);
    requirePlayer(game, actorId);
    requireActive(game);
    return gameStateWriter.commitForfeit(game, actorId);
  }

  /** 手番のプレイヤーに対して chess-workers の推奨手を返す. 対局は変更しない. */
  public String suggest(long gameId, long actorId) {
    final GameRecord game = requirePlayableBy(gameId, actorId);
    return chessWorkersClient.suggest(game.fen(), game.states());
  }

  public List<GameRecord> list(GameFilter filter, PageSpec page) {
    return gameRepository.list(filter, page);
  }

  public List<MoveRecord> listMoves(MoveFilter filter, PageSpec page) {
    return moveRepository.list(filter, page);
  }

  private GameRecord requirePlayableBy(long gameId, long actorId) {
    final GameRecord game = requireGame(gameId);
    requirePlayer(game, actorId);
    requireActive(game);
    if (game.whomstId() != actorId) {
      throw new NotYourTurnException(actorId);
    }
    return game;
  }

  private GameRecord requireGame(long gameId) {
    return gameRepository
        .findById(gameId)
        .orElseThrow(() -> new ResourceNotFoundException("invalid game id"));
  }

  private void requirePlayer(GameRecord game, long actorId) {
    if (!game.isPlayer(actorId)) {
      throw new ActionForbiddenException(
          "user '" + actorId + "' not a player in game '" + game.id() + "'");
    }
  }

  private void requireActive(GameRecord game) {
    if (game.status().isTerminal()) {
      throw new StateConflictException(
          "game with ID '" + game.id() + "' already has '" + game.status() + "' status",
          game.status().name());
    }
  }
}
