package com.chessmatch.arena.repository.query;

import static org.assertj.core.api.Assertions.assertThat;

import com.chessmatch.arena.model.GameStatus;
import com.chessmatch.arena.model.PageSpec;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ListQuerySqlTest {

  private static final String BASE = "SELECT g.* FROM games g";

  @Test
  void rendersConjunctionOrderAndPage() {
    final ListQuery<GameColumn> query =
        ListQuery.orderedBy(GameColumn.DATE_STARTED, new PageSpec(20, 5, true))
            .where(GameColumn.PLAYER_1, 4L)
            .where(GameColumn.STATUS, GameStatus.ACTIVE);

    final ListQuerySql.Rendered rendered = ListQuerySql.render(BASE, query, GameColumn.ID);

    assertThat(rendered.sql())
        .isEqualTo(
            """
            SELECT g.* FROM games g
            WHERE g.player_1 = :p0 AND g.status = :p1
            ORDER BY g.date_started DESC, g.id DESC
            LIMIT :limit OFFSET :skip""");
    assertThat(rendered.params().getValue("p0")).isEqualTo(4L);
    assertThat(rendered.params().getValue("p1")).isEqualTo("ACTIVE");
    assertThat(rendered.params().getValue("limit")).isEqualTo(5);
    assertThat(rendered.params().getValue("skip")).isEqualTo(20);
  }

  @Test
  void omitsWhereForNullFiltersAndSkipsRedundantTieBreak() {
    final ListQuery<GameColumn> query =
        ListQuery.orderedBy(GameColumn.ID, PageSpec.firstPage()).where(GameColumn.WINNER, null);

    final ListQuerySql.Rendered rendered = ListQuerySql.render(BASE, query, GameColumn.ID);

    assertThat(rendered.sql())
        .isEqualTo(
            """
            SELECT g.* FROM games g
            ORDER BY g.id ASC
            LIMIT :limit OFFSET :skip""");
    assertThat(rendered.params().hasValue("p0")).isFalse();
  }

  @Test
  void repeatedColumnKeepsTheLastValue() {
    final ListQuery<GameColumn> query =
        ListQuery.orderedBy(GameColumn.ID, PageSpec.firstPage())
            .where(GameColumn.WHOMST, 1L)
            .where(GameColumn.WHOMST, 2L);

    assertThat(query.predicates()).containsExactly(Map.entry(GameColumn.WHOMST, 2L));
  }

  @Test
  void apiNamesResolveCaseInsensitively() {
    assertThat(QueryColumn.fromApiName(UserColumn.class, " Date_Joined "))
        .contains(UserColumn.DATE_JOINED);
    assertThat(QueryColumn.fromApiName(UserColumn.class, "password_hash")).isEmpty();
    assertThat(QueryColumn.fromApiName(UserColumn.class, null)).isEmpty();
  }
}
