package com.chessmatch.arena.repository;

import com.chessmatch.arena.model.PageSpec;
import com.chessmatch.arena.model.UserFilter;
import com.chessmatch.arena.model.UserRecord;
import com.chessmatch.arena.repository.query.ListQuery;
import com.chessmatch.arena.repository.query.ListQuerySql;
import com.chessmatch.arena.repository.query.UserColumn;
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
public class UserRepository {

  private static final String SELECT_USERS =
      """
      SELECT u.id, u.name, u.email, u.password_hash, u.deleted, u.date_joined,
             u.wins, u.draws, u.losses
      FROM users u
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** name/email の一意制約違反は DuplicateKeyException として呼び出し元へ伝播する. */
  public UserRecord insert(String name, String email, String passwordHash, Instant dateJoined) {
    final String sql =
        """
        INSERT INTO users AS u (name, email, password_hash, deleted, date_joined)
        VALUES (:name, :email, :passwordHash, FALSE, :dateJoined)
        RETURNING u.id, u.name, u.email, u.password_hash, u.deleted, u.date_joined,
                  u.wins, u.draws, u.losses
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("email", email)
            .addValue("passwordHash", passwordHash)
            .addValue("dateJoined", JdbcTimestampUtils.toTimestamp(dateJoined));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<UserRecord> findById(long id) {
    final String sql = SELECT_USERS + "WHERE u.id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<UserRecord> findActiveByName(String name) {
    final String sql = SELECT_USERS + "WHERE u.name = :name AND u.deleted = FALSE";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("name", name);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<UserRecord> list(UserFilter filter, UserColumn orderBy, PageSpec page) {
    final ListQuery<UserColumn> query =
        ListQuery.orderedBy(orderBy, page)
            .where(UserColumn.ID, filter.id())
            .where(UserColumn.NAME, filter.name())
            .where(UserColumn.DELETED, filter.deleted());
    final ListQuerySql.Rendered rendered = ListQuerySql.render(SELECT_USERS, query, UserColumn.ID);
    return jdbcTemplate.query(rendered.sql(), rendered.params(), this::mapRow);
  }

  /**
   * 論理削除する. 既に削除済み/存在しない場合は 0 を返す.
   * 同時実行された削除のうち実際にフラグを反転した 1 件だけが 1 を得る.
   */
  public int softDelete(long id) {
    final String sql =
        """
        UPDATE users
        SET deleted = TRUE,
            email = NULL,
            password_hash = NULL
        WHERE id = :id
          AND deleted = FALSE
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("id", id));
  }

  public int addResult(long id, int wins, int draws, int losses) {
    final String sql =
        """
        UPDATE users
        SET wins = wins + :wins,
            draws = draws + :draws,
            losses = losses + :losses
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("wins", wins)
            .addValue("draws", draws)
            .addValue("losses", losses);
    return jdbcTemplate.update(sql, params);
  }

  private UserRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserRecord(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("email"),
        rs.getString("password_hash"),
        rs.getBoolean("deleted"),
        rs.getTimestamp("date_joined").toInstant(),
        rs.getInt("wins"),
        rs.getInt("draws"),
        rs.getInt("losses"));
  }
}
