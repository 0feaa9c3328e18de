package com.chessmatch.arena.repository;

import com.chessmatch.arena.model.MoveFilter;
import com.chessmatch.arena.model.MoveRecord;
import com.chessmatch.arena.model.PageSpec;
import com.chessmatch.arena.repository.query.ListQuery;
import com.chessmatch.arena.repository.query.ListQuerySql;
import com.chessmatch.arena.repository.query.MoveColumn;
import com.chessmatch.common.JdbcTimestampUtils;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** 着手履歴は追記のみ. 更新/削除メソッドは持たない. */
@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class MoveRepository {

  private static final String SELECT_MOVES =
      """
      SELECT m.id, m.user_id, m.game_id, m.played_at, m.movestr, m.fen
      FROM moves m
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public MoveRecord insert(long userId, long gameId, Instant playedAt, String movestr, String fen) {
    final String sql =
        """
        INSERT INTO moves AS m (user_id, game_id, played_at, movestr, fen)
        VALUES (:userId, :gameId, :playedAt, :movestr, :fen)
        RETURNING m.id, m.user_id, m.game_id, m.played_at, m.movestr, m.fen
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("gameId", gameId)
            .addValue("playedAt", JdbcTimestampUtils.toTimestamp(playedAt))
            .addValue("movestr", movestr)
            .addValue("fen", fen);
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public List<MoveRecord> list(MoveFilter filter, PageSpec page) {
    final ListQuery<MoveColumn> query =
        ListQuery.orderedBy(MoveColumn.TIMESTAMP, page)
            .where(MoveColumn.ID, filter.id())
            .where(MoveColumn.USER_ID, filter.userId())
            .where(MoveColumn.GAME_ID, filter.gameId());
    final ListQuerySql.Rendered rendered = ListQuerySql.render(SELECT_MOVES, query, MoveColumn.ID);
    return jdbcTemplate.query(rendered.sql(), rendered.params(), this::mapRow);
  }

  private MoveRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new MoveRecord(
        rs.getLong("id"),
        rs.getLong("user_id"),
        rs.getLong("game_id"),
        rs.getTimestamp("played_at").toInstant(),
        rs.getString("movestr"),
        rs.getString("fen"));
  }
}
