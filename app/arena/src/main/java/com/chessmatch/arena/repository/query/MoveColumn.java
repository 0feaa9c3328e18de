package com.chessmatch.arena.repository.query;

public enum MoveColumn implements QueryColumn {
  ID("m.id", "move_id"),
  USER_ID("m.user_id", "user_id"),
  GAME_ID("m.game_id", "game_id"),
  TIMESTAMP("m.played_at", "timestamp");

  private final String sql;
  private final String apiName;

  MoveColumn(String sql, String apiName) {
    this.sql = sql;
    this.apiName = apiName;
  }

  @Override
  public String sql() {
    return sql;
  }

  @Override
  public String apiName() {
    return apiName;
  }
}
