/*
 * どこで: Arena 一覧クエリ
 * 何を: 絞り込み/並び替えに使える列を表現する
 * なぜ: SQL に埋め込む列名を列挙型の既知集合だけに限定するため
 */
package com.chessmatch.arena.repository.query;

import java.util.Locale;
import java.util.Optional;

public interface QueryColumn {

  /** SQL 上の列式 (テーブル別名付き). */
  String sql();

  /** API で受け付ける名前. */
  String apiName();

  static <C extends Enum<C> & QueryColumn> Optional<C> fromApiName(Class<C> type, String name) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    final String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (C column : type.getEnumConstants()) {
      if (column.apiName().equals(normalized)) {
        return Optional.of(column);
      }
    }
    return Optional.empty();
  }
}
