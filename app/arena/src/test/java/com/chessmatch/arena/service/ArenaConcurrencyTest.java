/*
 * どこで: Arena サービス層の統合テスト
 * 何を: 招待の同時応答と同一手番の同時着手を Postgres 上で競合させる
 * なぜ: 条件付き UPDATE により勝者が 1 件だけになることを保証するため
 */
package com.chessmatch.arena.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.chessmatch.arena.AbstractPostgresContainerTest;
import com.chessmatch.arena.api.StateConflictException;
import com.chessmatch.arena.model.GameRecord;
import com.chessmatch.arena.model.GameType;
import com.chessmatch.arena.model.InvitationStatus;
import com.chessmatch.arena.repository.InvitationRepository;
import com.chessmatch.arena.repository.UserRepository;
import com.chessmatch.arena.service.dto.MoveResult;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

@SpringBootTest
@ActiveProfiles("test")
class ArenaConcurrencyTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T00:00:00Z");
  private static final Duration LATCH_TIMEOUT = Duration.ofSeconds(5);
  private static final Duration COMPLETION_TIMEOUT = Duration.ofSeconds(10);

  @Autowired private InvitationService invitationService;
  @Autowired private GameService gameService;
  @Autowired private InvitationRepository invitationRepository;
  @Autowired private UserRepository userRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @MockitoBean private ChessWorkersClient chessWorkersClient;

  private long aliceId;
  private long bobId;

  @BeforeEach
  void setUp() {
    deleteAll(jdbcTemplate);
    aliceId = userRepository.insert("alice", "alice@example.com", "hash", BASE_TIME).id();
    bobId = userRepository.insert("bob", "bob@example.com", "hash", BASE_TIME).id();
  }

  @Test
  void concurrentAcceptAndCancelHaveExactlyOneWinner() throws Exception {
    final long invitationId =
        invitationRepository.insert(aliceId, bobId, GameType.CHESS, BASE_TIME).id();

    final List<Object> results =
        race(
            () -> invitationService.accept(bobId, invitationId),
            () -> invitationService.cancel(aliceId, invitationId));

    final long conflicts =
        results.stream().filter(StateConflictException.class::isInstance).count();
    assertThat(conflicts).isEqualTo(1);
    final InvitationStatus finalStatus =
        invitationRepository.findById(invitationId).orElseThrow().status();
    final int games = countGames(invitationId);
    if (finalStatus == InvitationStatus.ACCEPTED) {
      assertThat(games).isEqualTo(1);
    } else {
      assertThat(finalStatus).isEqualTo(InvitationStatus.CANCELLED);
      assertThat(games).isZero();
    }
  }

  @Test
  void doubleAcceptCreatesOneGame() throws Exception {
    final long invitationId =
        invitationRepository.insert(aliceId, bobId, GameType.CHESS, BASE_TIME).id();

    final List<Object> results =
        race(
            () -> invitationService.accept(bobId, invitationId),
            () -> invitationService.accept(bobId, invitationId));

    assertThat(results).filteredOn(GameRecord.class::isInstance).hasSize(1);
    assertThat(results).filteredOn(StateConflictException.class::isInstance).hasSize(1);
    assertThat(countGames(invitationId)).isEqualTo(1);
  }

  @Test
  void concurrentMovesOnSameTurnCommitOnce() throws Exception {
    final GameRecord game =
        invitationService.accept(
            bobId, invitationRepository.insert(aliceId, bobId, GameType.CHESS, BASE_TIME).id());
    when(chessWorkersClient.move(anyString(), anyString(), anyString()))
        .thenReturn(
            new MoveResult(
                "MOVEOK", "rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq e3 0 1", "{}"));

    final List<Object> results =
        race(
            () -> gameService.move(game.id(), aliceId, "e2e4"),
            () -> gameService.move(game.id(), aliceId, "e2e4"));

    assertThat(results).filteredOn(GameRecord.class::isInstance).hasSize(1);
    assertThat(results).filteredOn(StateConflictException.class::isInstance).hasSize(1);
    final Integer moves =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM moves WHERE game_id = :gameId",
            new MapSqlParameterSource("gameId", game.id()),
            Integer.class);
    assertThat(moves).isEqualTo(1);
  }

  // 2 つの処理を同時に開始し、戻り値または例外を回収する
  private List<Object> race(Callable<?> first, Callable<?> second) throws InterruptedException {
    final CountDownLatch ready = new CountDownLatch(2);
    final CountDownLatch start = new CountDownLatch(1);
    final CountDownLatch done = new CountDownLatch(2);
    final List<Object> results = new CopyOnWriteArrayList<>();
    final ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      for (Callable<?> task : List.of(first, second)) {
        executor.submit(
            () -> {
              try {
                ready.countDown();
                if (!start.await(LATCH_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
                  results.add(new IllegalStateException("start latch timeout"));
                  return;
                }
                results.add(task.call());
              } catch (Throwable ex) {
                results.add(ex);
              } finally {
                done.countDown();
              }
            });
      }
      assertThat(ready.await(LATCH_TIMEOUT.toSeconds(), TimeUnit.SECONDS)).isTrue();
      start.countDown();
      assertThat(done.await(COMPLETION_TIMEOUT.toSeconds(), TimeUnit.SECONDS)).isTrue();
    } finally {
      executor.shutdownNow();
    }
    assertThat(results).hasSize(2);
    return results;
  }

  private int countGames(long invitationId) {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM games WHERE invitation_id = :invitationId",
            new MapSqlParameterSource("invitationId", invitationId),
            Integer.class);
    return count == null ? 0 : count;
  }
}
