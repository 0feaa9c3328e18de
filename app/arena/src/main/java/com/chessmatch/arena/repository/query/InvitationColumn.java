package com.chessmatch.arena.repository.query;

public enum InvitationColumn implements QueryColumn {
  ID("i.id", "invitation_id"),
  FROM_ID("i.from_id", "from_id"),
  TO_ID("i.to_id", "to_id"),
  STATUS("i.status", "status"),
  GAME_TYPE("i.game_type", "game_type"),
  DATE_SENT("i.date_sent", "date_sent");

  private final String sql;
  private final String apiName;

  InvitationColumn(String sql, String apiName) {
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
