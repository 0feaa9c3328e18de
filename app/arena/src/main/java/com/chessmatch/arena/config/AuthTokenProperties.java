/*
 * どこで: Arena 設定
 * 何を: セッショントークンの署名鍵/アルゴリズム/有効期間を保持する
 * なぜ: 起動時に一度だけ束縛し、弱い鍵や未知のアルゴリズムで起動させないため
 */
package com.chessmatch.arena.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "arena.auth.token")
@Validated
public record AuthTokenProperties(@NotBlank String secret, String algorithm, Duration ttl) {

  // HMAC の鍵長はハッシュ長以上が必要
  private static final Map<String, Integer> MIN_SECRET_BYTES =
      Map.of("HS256", 32, "HS384", 48, "HS512", 64);

  public AuthTokenProperties {
    algorithm =
        algorithm == null || algorithm.isBlank() ? "HS256" : algorithm.trim().toUpperCase(Locale.ROOT);
    ttl = ttl == null ? Duration.ofDays(7) : ttl;
  }

  @AssertTrue(message = "arena.auth.token.algorithm must be one of HS256, HS384, HS512")
  public boolean isAlgorithmSupported() {
    return MIN_SECRET_BYTES.containsKey(algorithm);
  }

  @AssertTrue(message = "arena.auth.token.secret is too short for the configured algorithm")
  public boolean isSecretLongEnough() {
    if (secret == null || !isAlgorithmSupported()) {
      return true;
    }
    return secret.getBytes(StandardCharsets.UTF_8).length >= MIN_SECRET_BYTES.get(algorithm);
  }

  @AssertTrue(message = "arena.auth.token.ttl must be positive")
  public boolean isTtlPositive() {
    return !ttl.isZero() && !ttl.isNegative();
  }
}
