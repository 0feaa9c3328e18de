/*
 * どこで: Arena 招待リポジトリ
 * 何を: 招待の作成/参照/条件付き状態遷移を行う
 * なぜ: 状態遷移を WHERE status = 'PENDING' の CAS に限定し、同時 accept を 1 件だけ成功させるため
 */
package com.chessmatch.arena.repository;

import com.chessmatch.arena.model.GameType;
import com.chessmatch.arena.model.InvitationFilter;
import com.chessmatch.arena.model.InvitationRecord;
import com.chessmatch.arena.model.InvitationStatus;
import com.chessmatch.arena.model.PageSpec;
import com.chessmatch.arena.repository.query.InvitationColumn;
import com.chessmatch.arena.repository.query.ListQuery;
import com.chessmatch.arena.repository.query.ListQuerySql;
import com.chessmatch.common.JdbcTimestampUtils;
import java.sql.ResultSet;
import java.sql.SQLException;
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
public class InvitationRepository {

  // 論理削除済みユーザーの name も残るため INNER JOIN で常に解決できる
  private static final String SELECT_INVITATIONS =
      """
      SELECT i.id, i.date_sent, i.date_answered, i.from_id, f.name AS from_name,
             i.to_id, t.name AS to_name, i.game_type, i.status
      FROM invitations i
      JOIN users f ON f.id = i.from_id
      JOIN users t ON t.id = i.to_id
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public InvitationRecord insert(long fromId, long toId, GameType gameType, Instant dateSent) {
    final String sql =
        """
        WITH i AS (
          INSERT INTO invitations (date_sent, from_id, to_id, game_type, status)
          VALUES (:dateSent, :fromId, :toId, :gameType, 'PENDING')
          RETURNING *
        )
        SELECT i.id, i.date_sent, i.date_answered, i.from_id, f.name AS from_name,
               i.to_id, t.name AS to_name, i.game_type, i.status
        FROM i
        JOIN users f ON f.id = i.from_id
        JOIN users t ON t.id = i.to_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("dateSent", JdbcTimestampUtils.toTimestamp(dateSent))
            .addValue("fromId", fromId)
            .addValue("toId", toId)
            .addValue("gameType", gameType.name());
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<InvitationRecord> findById(long id) {
    final String sql = SELECT_INVITATIONS + "WHERE i.id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<InvitationRecord> list(InvitationFilter filter, PageSpec page) {
    final ListQuery<InvitationColumn> query =
        ListQuery.orderedBy(InvitationColumn.DATE_SENT, page)
            .where(InvitationColumn.ID, filter.id())
            .where(InvitationColumn.FROM_ID, filter.fromId())
            .where(InvitationColumn.TO_ID, filter.toId())
            .where(InvitationColumn.STATUS, filter.status())
            .where(InvitationColumn.GAME_TYPE, filter.gameType());
    final ListQuerySql.Rendered rendered =
        ListQuerySql.render(SELECT_INVITATIONS, query, InvitationColumn.ID);
    return jdbcTemplate.query(rendered.sql(), rendered.params(), this::mapRow);
  }

  /**
   * PENDING のままであれば target へ遷移させる. 既に遷移済み (競合に負けた場合を含む) なら空.
   */
  public Optional<InvitationRecord> transitionFromPending(
      long id, InvitationStatus target, Instant answeredAt) {
    final String sql =
        """
        WITH i AS (
          UPDATE invitations
          SET status = :target,
              date_answered = :answeredAt
          WHERE id = :id
            AND status = 'PENDING'
          RETURNING *
        )
        SELECT i.id, i.date_sent, i.date_answered, i.from_id, f.name AS from_name,
               i.to_id, t.name AS to_name, i.game_type, i.status
        FROM i
        JOIN users f ON f.id = i.from_id
        JOIN users t ON t.id = i.to_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("target", target.name())
            .addValue("answeredAt", JdbcTimestampUtils.toTimestamp(answeredAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private InvitationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new InvitationRecord(
        rs.getLong("id"),
        rs.getTimestamp("date_sent").toInstant(),
        JdbcTimestampUtils.readInstant(rs, "date_answered"),
        rs.getLong("from_id"),
        rs.getString("from_name"),
        rs.getLong("to_id"),
        rs.getString("to_name"),
        GameType.valueOf(rs.getString("game_type")),
        InvitationStatus.valueOf(rs.getString("status")));
  }
}
