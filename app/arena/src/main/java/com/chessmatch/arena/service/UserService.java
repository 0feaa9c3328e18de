/*
 * どこで: Arena サービス層
 * 何を: ユーザー登録/一覧/論理削除/ログインを提供する
 * なぜ: 重複検出を DB 一意制約に一本化し、ログイン失敗理由を外部へ漏らさないため
 */
package com.chessmatch.arena.service;

import com.chessmatch.arena.api.DuplicateIdentityException;
import com.chessmatch.arena.api.ResourceNotFoundException;
import com.chessmatch.arena.model.PageSpec;
import com.chessmatch.arena.model.UserFilter;
import com.chessmatch.arena.model.UserRecord;
import com.chessmatch.arena.repository.UserRepository;
import com.chessmatch.arena.repository.query.UserColumn;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class UserService {

  private static final Logger logger = LoggerFactory.getLogger(UserService.class);

  private final UserRepository userRepository;
  private final CredentialService credentialService;
  private final ArenaMetrics metrics;
  private final Clock clock;

  public UserRecord create(@NonNull String name, @NonNull String email, @NonNull String password) {
    final String passwordHash = credentialService.hash(password);
    try {
      final UserRecord created =
          userRepository.insert(name, email, passwordHash, clock.instant());
      logger.info("user created userId={} name={}", created.id(), created.name());
      return created;
    } catch (DataIntegrityViolationException ex) {
      throw new DuplicateIdentityException("user with same name or email already exists", ex);
    }
  }

  public List<UserRecord> list(UserFilter filter, UserColumn orderBy, PageSpec page) {
    return userRepository.list(filter, orderBy, page);
  }

  public UserRecord get(long userId) {
    return userRepository
        .findById(userId)
        .orElseThrow(
            () -> new ResourceNotFoundException("user with ID '" + userId + "' does not exist"));
  }

  /** 実際に削除フラグを立てた呼び出しだけが true を得る. */
  public boolean softDelete(long userId) {
    final boolean deleted = userRepository.softDelete(userId) == 1;
    if (deleted) {
      logger.info("user soft-deleted userId={}", userId);
    } else {
      logger.info("user soft-delete skipped (missing or already deleted) userId={}", userId);
    }
    return deleted;
  }

  /**
   * 有効なユーザー名とパスワードの組に対してのみトークンを返す.
   * ユーザー不在/パスワード不一致/削除済みはすべて空で区別しない.
   */
  public Optional<String> login(String name, String password) {
    final Optional<UserRecord> user =
        name == null ? Optional.empty() : userRepository.findActiveByName(name);
    if (user.isEmpty()) {
      credentialService.verifyAgainstNothing(password);
      metrics.recordLogin(false);
      return Optional.empty();
    }
    if (!credentialService.verify(password, user.get().passwordHash())) {
      metrics.recordLogin(false);
      return Optional.empty();
    }
    metrics.recordLogin(true);
    return Optional.of(credentialService.issue(user.get().id(), user.get().name()));
  }
}
