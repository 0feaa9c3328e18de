package com.chessmatch.arena.repository.query;

public enum UserColumn implements QueryColumn {
  ID("u.id", "user_id"),
  NAME("u.name", "user_name"),
  DELETED("u.deleted", "deleted"),
  DATE_JOINED("u.date_joined", "date_joined"),
  WINS("u.wins", "wins"),
  DRAWS("u.draws", "draws"),
  LOSSES("u.losses", "losses");

  private final String sql;
  private final String apiName;

  UserColumn(String sql, String apiName) {
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
