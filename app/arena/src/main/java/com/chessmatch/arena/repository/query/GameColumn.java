package com.chessmatch.arena.repository.query;

public enum GameColumn implements QueryColumn {
  ID("g.id", "game_id"),
  INVITATION_ID("g.invitation_id", "invitation_id"),
  PLAYER_1("g.player_1", "player1_id"),
  PLAYER_2("g.player_2", "player2_id"),
  WHOMST("g.whomst", "whomst_id"),
  WINNER("g.winner", "winner_id"),
  STATUS("g.status", "status"),
  DATE_STARTED("g.date_started", "date_started");

  private final String sql;
  private final String apiName;

  GameColumn(String sql, String apiName) {
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
