package com.chessmatch.arena.repository.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/** {@link ListQuery} を名前付きパラメータ付き SQL へ変換する. */
public final class ListQuerySql {

  private ListQuerySql() {}

  public record Rendered(String sql, MapSqlParameterSource params) {}

  /**
   * @param baseSelect WHERE 句を含まない SELECT ... FROM ... JOIN ...
   * @param tieBreaker 並び順が同値の行を安定させる一意列
   */
  public static Rendered render(
      String baseSelect, ListQuery<? extends QueryColumn> query, QueryColumn tieBreaker) {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    final List<String> conditions = new ArrayList<>();
    int index = 0;
    for (Map.Entry<? extends QueryColumn, Object> entry : query.predicates().entrySet()) {
      final String name = "p" + index++;
      conditions.add(entry.getKey().sql() + " = :" + name);
      params.addValue(name, bindable(entry.getValue()));
    }

    final StringBuilder sql = new StringBuilder(baseSelect.strip());
    if (!conditions.isEmpty()) {
      sql.append("\nWHERE ").append(String.join(" AND ", conditions));
    }
    final String direction = query.page().reverse() ? "DESC" : "ASC";
    sql.append("\nORDER BY ").append(query.orderBy().sql()).append(' ').append(direction);
    if (!query.orderBy().sql().equals(tieBreaker.sql())) {
      sql.append(", ").append(tieBreaker.sql()).append(' ').append(direction);
    }
    sql.append("\nLIMIT :limit OFFSET :skip");
    params.addValue("limit", query.page().limit());
    params.addValue("skip", query.page().skip());
    return new Rendered(sql.toString(), params);
  }

  private static Object bindable(Object value) {
    if (value instanceof Enum<?> constant) {
      return constant.name();
    }
    return value;
  }
}
