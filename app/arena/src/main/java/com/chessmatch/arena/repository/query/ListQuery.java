/*
 * どこで: Arena 一覧クエリ
 * 何を: 等値条件の論理積 + 並び順 + ページ指定を保持する
 * なぜ: ユーザー/招待/対局/着手の一覧で同じ組み立て方を使うため
 */
package com.chessmatch.arena.repository.query;

import com.chessmatch.arena.model.PageSpec;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class ListQuery<C extends QueryColumn> {

  private final Map<C, Object> predicates = new LinkedHashMap<>();
  private final C orderBy;
  private final PageSpec page;

  private ListQuery(C orderBy, PageSpec page) {
    this.orderBy = Objects.requireNonNull(orderBy, "orderBy");
    this.page = Objects.requireNonNull(page, "page");
  }

  public static <C extends QueryColumn> ListQuery<C> orderedBy(C orderBy, PageSpec page) {
    return new ListQuery<>(orderBy, page);
  }

  /** 値が null の条件は付与しない. 同じ列を再指定した場合は後勝ち. */
  public ListQuery<C> where(C column, Object value) {
    if (value != null) {
      predicates.put(column, value);
    }
    return this;
  }

  public Map<C, Object> predicates() {
    return Collections.unmodifiableMap(predicates);
  }

  public C orderBy() {
    return orderBy;
  }

  public PageSpec page() {
    return page;
  }
}
