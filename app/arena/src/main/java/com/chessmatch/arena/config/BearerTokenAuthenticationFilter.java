/*
 * どこで: Arena セキュリティ
 * 何を: Authorization: Bearer のセッショントークンを検証し認証情報を確立する
 * なぜ: 署名/期限の検証に加え、トークン発行後に論理削除されたユーザーを拒否するため
 */
package com.chessmatch.arena.config;

import com.chessmatch.arena.model.TokenClaims;
import com.chessmatch.arena.model.UserRecord;
import com.chessmatch.arena.repository.UserRepository;
import com.chessmatch.arena.service.CredentialService;
import com.chessmatch.arena.service.InvalidTokenException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(BearerTokenAuthenticationFilter.class);
  private static final String BEARER_PREFIX = "Bearer ";
  private static final String PLAYER_ROLE = "ROLE_PLAYER";

  private final CredentialService credentialService;
  private final UserRepository userRepository;

  public BearerTokenAuthenticationFilter(
      CredentialService credentialService, UserRepository userRepository) {
    this.credentialService = credentialService;
    this.userRepository = userRepository;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String header = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (header == null || header.isBlank()) {
      // 未認証のまま進め、保護パスなら認可フィルタが 401 を返す
      filterChain.doFilter(request, response);
      return;
    }
    if (!header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      reject(response, request, "invalid token");
      return;
    }

    final TokenClaims claims;
    try {
      claims = credentialService.decode(header.substring(BEARER_PREFIX.length()).trim());
    } catch (InvalidTokenException ex) {
      reject(response, request, ex.getMessage());
      return;
    }

    final Optional<UserRecord> user = userRepository.findById(claims.userId());
    if (user.isEmpty()) {
      reject(response, request, "invalid token");
      return;
    }
    if (user.get().deleted()) {
      reject(response, request, "user has been deleted");
      return;
    }

    final UsernamePasswordAuthenticationToken authentication =
        new UsernamePasswordAuthenticationToken(
            String.valueOf(claims.userId()),
            "N/A",
            List.of(new SimpleGrantedAuthority(PLAYER_ROLE)));
    SecurityContextHolder.getContext().setAuthentication(authentication);
    filterChain.doFilter(request, response);
  }

  private void reject(HttpServletResponse response, HttpServletRequest request, String message)
      throws IOException {
    logger.warn("bearer token rejected path={} reason={}", request.getRequestURI(), message);
    SecurityContextHolder.clearContext();
    response.sendError(HttpServletResponse.SC_UNAUTHORIZED, message);
  }
}
