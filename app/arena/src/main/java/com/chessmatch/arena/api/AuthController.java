/*
 * どこで: Arena API
 * 何を: サインアップとログインのエンドポイントを公開する
 * なぜ: Bearer トークン不要の入口をこの 2 つに限定するため
 */
package com.chessmatch.arena.api;

import com.chessmatch.arena.api.request.LoginRequest;
import com.chessmatch.arena.api.request.SignupRequest;
import com.chessmatch.arena.api.response.LoginResponse;
import com.chessmatch.arena.api.response.UserResponse;
import com.chessmatch.arena.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class AuthController {

  private final UserService userService;

  @PostMapping("/signup")
  public ResponseEntity<UserResponse> signup(@Valid @RequestBody SignupRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            UserResponse.selfView(
                userService.create(request.name(), request.email(), request.password())));
  }

  @PostMapping("/login")
  public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
    return userService
        .login(request.name(), request.password())
        .map(token -> ResponseEntity.ok(new LoginResponse(token)))
        .orElseThrow(InvalidCredentialsException::new);
  }
}
