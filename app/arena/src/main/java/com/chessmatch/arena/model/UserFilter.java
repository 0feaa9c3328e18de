package com.chessmatch.arena.model;

public record UserFilter(Long id, String name, Boolean deleted) {

  public static UserFilter none() {
    return new UserFilter(null, null, null);
  }
}
