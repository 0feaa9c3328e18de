/*
 * どこで: Arena 対局リポジトリ
 * 何を: 対局の作成/参照と、盤面更新・終局の条件付き更新を行う
 * なぜ: chess-workers 呼び出し中に他リクエストが盤面を進めていた場合に上書きしないため
 */
package com.chessmatch.arena.repository;

import com.chessmatch.arena.model.GameFilter;
import com.chessmatch.arena.model.GameRecord;
import com.chessmatch.arena.model.GameStatus;
import com.chessmatch.arena.model.GameType;
import com.chessmatch.arena.model.PageSpec;
import com.chessmatch.arena.repository.query.GameColumn;
import com.chessmatch.arena.repository.query.ListQuery;
import com.chessmatch.arena.repository.query.ListQuerySql;
import com.chessmatch.common.JdbcTimestampUtils;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class GameRepository {

  private static final String GAME_COLUMNS =
      """
      SELECT g.id, g.game_type, g.invitation_id, g.date_started, g.date_ended,
             g.player_1, p1.name AS player_1_name, g.player_2, p2.name AS player_2_name,
             g.whomst, g.winner, g.status, g.fen, g.states
      """;

  private static final String SELECT_GAMES =
      GAME_COLUMNS
          + """
          FROM games g
          JOIN users p1 ON p1.id = g.player_1
          JOIN users p2 ON p2.id = g.player_2
          """;

  // RETURNING した行に名前を付けて返す共通の後半部
  private static final String FROM_CHANGED =
      GAME_COLUMNS
          + """
          FROM g
          JOIN users p1 ON p1.id = g.player_1
          JOIN users p2 ON p2.id = g.player_2
          """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** player_1 は招待者 (先手/白). invitation_id の一意制約で 1 招待 1 対局を保証する. */
  public GameRecord insert(
      long invitationId,
      GameType gameType,
      long player1Id,
      long player2Id,
      Instant dateStarted,
      String fen,
      String states) {
    final String sql =
        """
        WITH g AS (
          INSERT INTO games (game_type, invitation_id, date_started, player_1, player_2,
                             whomst, status, fen, states)
          VALUES (:gameType, :invitationId, :dateStarted, :player1, :player2,
                  :player1, 'ACTIVE', :fen, :states)
          RETURNING *
        )
        """
            + FROM_CHANGED;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("gameType", gameType.name())
            .addValue("invitationId", invitationId)
            .addValue("dateStarted", JdbcTimestampUtils.toTimestamp(dateStarted))
            .addValue("player1", player1Id)
            .addValue("player2", player2Id)
            .addValue("fen", fen)
            .addValue("states", states);
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<GameRecord> findById(long id) {
    final String sql = SELECT_GAMES + "WHERE g.id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<GameRecord> list(GameFilter filter, PageSpec page) {
    final ListQuery<GameColumn> query =
        ListQuery.orderedBy(GameColumn.DATE_STARTED, page)
            .where(GameColumn.ID, filter.id())
            .where(GameColumn.INVITATION_ID, filter.invitationId())
            .where(GameColumn.PLAYER_1, filter.player1Id())
            .where(GameColumn.PLAYER_2, filter.player2Id())
            .where(GameColumn.WHOMST, filter.whomstId())
            .where(GameColumn.WINNER, filter.winnerId())
            .where(GameColumn.STATUS, filter.status());
    final ListQuerySql.Rendered rendered = ListQuerySql.render(SELECT_GAMES, query, GameColumn.ID);
    return jdbcTemplate.query(rendered.sql(), rendered.params(), this::mapRow);
  }

  /**
   * 着手結果を反映する. 読み込み時点から手番/盤面/状態が変わっていれば何もせず空を返す.
   */
  public Optional<GameRecord> applyMove(GameMoveUpdate update) {
    final String sql =
        """
        WITH g AS (
          UPDATE games
          SET fen = :fen,
              states = :states,
              whomst = :nextWhomst,
              status = :status,
              winner = :winner,
              date_ended = :dateEnded
          WHERE id = :id
            AND status = 'ACTIVE'
            AND whomst = :mover
            AND fen = :previousFen
          RETURNING *
        )
        """
            + FROM_CHANGED;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", update.gameId())
            .addValue("mover", update.moverId())
            .addValue("previousFen", update.previousFen())
            .addValue("fen", update.fen())
            .addValue("states", update.states())
            .addValue("nextWhomst", update.nextWhomstId())
            .addValue("status", update.status().name())
            .addValue("winner", update.winnerId(), Types.BIGINT)
            .addValue(
                "dateEnded", JdbcTimestampUtils.toTimestamp(update.dateEnded()), Types.TIMESTAMP);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** 進行中の対局だけを終局させる (投了). */
  public Optional<GameRecord> finishIfActive(
      long gameId, GameStatus status, Long winnerId, Instant dateEnded) {
    final String sql =
        """
        WITH g AS (
          UPDATE games
          SET status = :status,
              winner = :winner,
              date_ended = :dateEnded
          WHERE id = :id
            AND status = 'ACTIVE'
          RETURNING *
        )
        """
            + FROM_CHANGED;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", gameId)
            .addValue("status", status.name())
            .addValue("winner", winnerId, Types.BIGINT)
            .addValue("dateEnded", JdbcTimestampUtils.toTimestamp(dateEnded));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private GameRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new GameRecord(
        rs.getLong("id"),
        GameType.valueOf(rs.getString("game_type")),
        rs.getLong("invitation_id"),
        rs.getTimestamp("date_started").toInstant(),
        JdbcTimestampUtils.readInstant(rs, "date_ended"),
        rs.getLong("player_1"),
        rs.getString("player_1_name"),
        rs.getLong("player_2"),
        rs.getString("player_2_name"),
        rs.getLong("whomst"),
        rs.getObject("winner", Long.class),
        GameStatus.valueOf(rs.getString("status")),
        rs.getString("fen"),
        rs.getString("states"));
  }
}
