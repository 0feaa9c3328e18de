package com.chessmatch.arena.api.response;

import com.chessmatch.arena.model.UserRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** email は本人向け応答 (/signup, /users/self) にのみ含める. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserResponse(
    long id,
    String name,
    String email,
    boolean deleted,
    Instant dateJoined,
    int wins,
    int draws,
    int losses) {

  public static UserResponse publicView(UserRecord user) {
    return new UserResponse(
        user.id(),
        user.name(),
        null,
        user.deleted(),
        user.dateJoined(),
        user.wins(),
        user.draws(),
        user.losses());
  }

  public static UserResponse selfView(UserRecord user) {
    return new UserResponse(
        user.id(),
        user.name(),
        user.email(),
        user.deleted(),
        user.dateJoined(),
        user.wins(),
        user.draws(),
        user.losses());
  }
}
