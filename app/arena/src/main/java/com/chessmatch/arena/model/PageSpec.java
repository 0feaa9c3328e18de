/*
 * どこで: Arena 一覧取得
 * 何を: skip/limit/reverse のページ指定を保持する
 * なぜ: 全エンティティの一覧で同じ上限と既定値を使うため
 */
package com.chessmatch.arena.model;

public record PageSpec(int skip, int limit, boolean reverse) {

  public static final int DEFAULT_LIMIT = 10;
  public static final int MAX_LIMIT = 50;

  public PageSpec {
    if (skip < 0) {
      throw new IllegalArgumentException("skip must be >= 0");
    }
    if (limit <= 0 || limit > MAX_LIMIT) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
    }
  }

  public static PageSpec firstPage() {
    return new PageSpec(0, DEFAULT_LIMIT, false);
  }
}
