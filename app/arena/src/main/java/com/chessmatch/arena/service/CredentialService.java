/*
 * どこで: Arena サービス層
 * 何を: パスワードのハッシュ/照合と、署名付きセッショントークンの発行/検証を行う
 * なぜ: 認証の暗号処理を BCrypt と jjwt に委ね、設定から一度だけ鍵を組み立てるため
 */
package com.chessmatch.arena.service;

import com.chessmatch.arena.config.AuthTokenProperties;
import com.chessmatch.arena.model.TokenClaims;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.MacAlgorithm;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

@Service
public class CredentialService {

  static final String CLAIM_USER_ID = "user_id";
  static final String CLAIM_USER_NAME = "user";

  private final PasswordEncoder passwordEncoder;
  private final Clock clock;
  private final MacAlgorithm algorithm;
  private final SecretKey key;
  private final AuthTokenProperties properties;
  // 存在しないユーザーでも照合処理を 1 回走らせるための捨てハッシュ
  private final String unmatchableHash;

  public CredentialService(
      PasswordEncoder passwordEncoder, AuthTokenProperties properties, Clock clock) {
    this.passwordEncoder = passwordEncoder;
    this.properties = properties;
    this.clock = clock;
    this.algorithm = resolveAlgorithm(properties.algorithm());
    this.key =
        new SecretKeySpec(
            properties.secret().getBytes(StandardCharsets.UTF_8), jcaName(properties.algorithm()));
    this.unmatchableHash = passwordEncoder.encode(UUID.randomUUID().toString());
  }

  public String hash(String password) {
    return passwordEncoder.encode(password);
  }

  public boolean verify(String password, String hash) {
    if (password == null || hash == null) {
      return false;
    }
    return passwordEncoder.matches(password, hash);
  }

  /** ユーザー不在時に呼び、照合に要する時間を揃える. 常に false. */
  public boolean verifyAgainstNothing(String password) {
    passwordEncoder.matches(password == null ? "" : password, unmatchableHash);
    return false;
  }

  public String issue(long userId, String userName) {
    final Instant now = clock.instant();
    return Jwts.builder()
        .subject(String.valueOf(userId))
        .claim(CLAIM_USER_ID, userId)
        .claim(CLAIM_USER_NAME, userName)
        .issuedAt(Date.from(now))
        .expiration(Date.from(now.plus(properties.ttl())))
        .signWith(key, algorithm)
        .compact();
  }

  public TokenClaims decode(String token) {
    final Jws<Claims> jws;
    try {
      jws =
          Jwts.parser()
              .verifyWith(key)
              .clock(() -> Date.from(clock.instant()))
              .build()
              .parseSignedClaims(token);
    } catch (ExpiredJwtException ex) {
      throw new InvalidTokenException(InvalidTokenException.Reason.EXPIRED, "expired token", ex);
    } catch (JwtException | IllegalArgumentException ex) {
      throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "invalid token", ex);
    }
    if (!algorithm.getId().equals(jws.getHeader().getAlgorithm())) {
      throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "invalid token", null);
    }
    final Claims claims = jws.getPayload();
    if (claims.getSubject() == null
        || claims.getIssuedAt() == null
        || claims.getExpiration() == null) {
      throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "invalid token", null);
    }
    final long userId;
    try {
      userId = Long.parseLong(claims.getSubject());
    } catch (NumberFormatException ex) {
      throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "invalid token", ex);
    }
    return new TokenClaims(
        userId,
        claims.get(CLAIM_USER_NAME, String.class),
        claims.getIssuedAt().toInstant(),
        claims.getExpiration().toInstant());
  }

  private static MacAlgorithm resolveAlgorithm(String name) {
    return switch (name) {
      case "HS256" -> Jwts.SIG.HS256;
      case "HS384" -> Jwts.SIG.HS384;
      case "HS512" -> Jwts.SIG.HS512;
      default -> throw new IllegalStateException("unsupported token algorithm: " + name);
    };
  }

  private static String jcaName(String name) {
    return "Hmac" + name.replace("HS", "SHA");
  }
}
