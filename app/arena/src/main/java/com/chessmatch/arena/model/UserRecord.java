package com.chessmatch.arena.model;

import java.time.Instant;

public record UserRecord(
    long id,
    String name,
    String email,
    String passwordHash,
    boolean deleted,
    Instant dateJoined,
    int wins,
    int draws,
    int losses) {

  public boolean isActive() {
    return !deleted;
  }
}
