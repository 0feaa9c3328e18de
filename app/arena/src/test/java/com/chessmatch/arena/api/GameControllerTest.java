package com.chessmatch.arena.api;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.chessmatch.arena.model.GameFilter;
import com.chessmatch.arena.model.GameRecord;
import com.chessmatch.arena.model.GameStatus;
import com.chessmatch.arena.model.GameType;
import com.chessmatch.arena.model.PageSpec;
import com.chessmatch.arena.service.ChessWorkersIntegrationException;
import com.chessmatch.arena.service.GameService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(GameController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
@ActiveProfiles("test")
class GameControllerTest {

  private static final UsernamePasswordAuthenticationToken ALICE =
      new UsernamePasswordAuthenticationToken("1", "N/A", List.of());
  private static final String FEN_AFTER_E4 =
      "rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq e3 0 1";

  @Autowired private MockMvc mockMvc;

  @MockitoBean private GameService gameService;

  @Test
  void listSerializesBoardAndStates() throws Exception {
    when(gameService.list(
            new GameFilter(null, null, 1L, null, null, null, GameStatus.ACTIVE),
            PageSpec.firstPage()))
        .thenReturn(List.of(game(GameStatus.ACTIVE, 1L, null, GameService.INITIAL_FEN)));

    mockMvc
        .perform(
            get("/games").principal(ALICE).param("player1_id", "1").param("status", "ACTIVE"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].player_1").value(1))
        .andExpect(jsonPath("$[0].player_2_name").value("bob"))
        .andExpect(jsonPath("$[0].whomst").value(1))
        .andExpect(jsonPath("$[0].fen").value(GameService.INITIAL_FEN))
        .andExpect(jsonPath("$[0].states.halfmove").value(0))
        .andExpect(jsonPath("$[0].winner").doesNotExist());
  }

  @Test
  void unknownStatusValueIs400() throws Exception {
    mockMvc
        .perform(get("/games").principal(ALICE).param("status", "PAUSED"))
        .andExpect(status().isBadRequest());
    verifyNoInteractions(gameService);
  }

  @Test
  void moveTrimsInputAndReturnsGame() throws Exception {
    when(gameService.move(5L, 1L, "e2e4"))
        .thenReturn(game(GameStatus.ACTIVE, 2L, null, FEN_AFTER_E4));

    mockMvc
        .perform(
            post("/games/5/move")
                .principal(ALICE)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"move\":\" e2e4 \"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.whomst").value(2))
        .andExpect(jsonPath("$.fen").value(FEN_AFTER_E4));
  }

  @Test
  void blankMoveIs422() throws Exception {
    mockMvc
        .perform(
            post("/games/5/move")
                .principal(ALICE)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"move\":\"  \"}"))
        .andExpect(status().isUnprocessableEntity());
    verifyNoInteractions(gameService);
  }

  @Test
  void moveOutOfTurnIs409() throws Exception {
    when(gameService.move(5L, 1L, "e7e5")).thenThrow(new NotYourTurnException(1L));

    mockMvc
        .perform(
            post("/games/5/move")
                .principal(ALICE)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"move\":\"e7e5\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("ARENA_NOT_YOUR_TURN"))
        .andExpect(jsonPath("$.message").value("it is not the turn of user with id '1'"));
  }

  @Test
  void illegalMoveIs400WithWorkersMessage() throws Exception {
    when(gameService.move(5L, 1L, "e2e5"))
        .thenThrow(
            new ChessWorkersIntegrationException(
                ChessWorkersIntegrationException.Reason.MOVE_REJECTED, "invalid move"));

    mockMvc
        .perform(
            post("/games/5/move")
                .principal(ALICE)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"move\":\"e2e5\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("ARENA_MOVE_REJECTED"))
        .andExpect(jsonPath("$.message").value("invalid move"));
  }

  @Test
  void workersOutageIs500WithoutDetails() throws Exception {
    when(gameService.move(5L, 1L, "e2e4"))
        .thenThrow(
            new ChessWorkersIntegrationException(
                ChessWorkersIntegrationException.Reason.TIMEOUT, "chess-workers request timeout"));

    mockMvc
        .perform(
            post("/games/5/move")
                .principal(ALICE)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"move\":\"e2e4\"}"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("ARENA_WORKERS_FAILURE"))
        .andExpect(jsonPath("$.message").value("move validation is unavailable"));
  }

  @Test
  void forfeitReturnsFinishedGame() throws Exception {
    when(gameService.forfeit(5L, 1L))
        .thenReturn(game(GameStatus.BLACK_WINS, 1L, 2L, GameService.INITIAL_FEN));

    mockMvc
        .perform(post("/games/5/forfeit").principal(ALICE))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("BLACK_WINS"))
        .andExpect(jsonPath("$.winner").value(2));
  }

  @Test
  void suggestionReturnsMove() throws Exception {
    when(gameService.suggest(5L, 1L)).thenReturn("e2e4");

    mockMvc
        .perform(post("/games/5/suggestion").principal(ALICE))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.move").value("e2e4"));
  }

  @Test
  void listReportsServerSideIllegalArgumentAs500() throws Exception {
    when(gameService.list(
            new GameFilter(null, null, null, null, null, null, null), PageSpec.firstPage()))
        .thenThrow(new IllegalArgumentException("unexpected column"));

    mockMvc
        .perform(get("/games").principal(ALICE))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("ARENA_INTERNAL_ERROR"));
  }

  private static GameRecord game(GameStatus status, long whomst, Long winner, String fen) {
    return new GameRecord(
        5L,
        GameType.CHESS,
        10L,
        Instant.parse("2026-03-01T10:00:00Z"),
        status.isTerminal() ? Instant.parse("2026-03-01T10:30:00Z") : null,
        1L,
        "alice",
        2L,
        "bob",
        whomst,
        winner,
        status,
        fen,
        "{\"halfmove\":0}");
  }
}
