package com.chessmatch.arena.api;

import org.springframework.security.core.Authentication;

/** BearerTokenAuthenticationFilter が principal 名に格納した user id を取り出す. */
final class AuthenticatedUser {
  private AuthenticatedUser() {}

  static long id(Authentication authentication) {
    if (authentication == null) {
      throw new IllegalStateException("request is not authenticated");
    }
    return Long.parseLong(authentication.getName());
  }
}
