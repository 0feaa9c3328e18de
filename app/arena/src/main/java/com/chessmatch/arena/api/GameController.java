package com.chessmatch.arena.api;

import com.chessmatch.arena.api.request.MoveRequest;
import com.chessmatch.arena.api.response.GameResponse;
import com.chessmatch.arena.api.response.SuggestionResponse;
import com.chessmatch.arena.model.GameFilter;
import com.chessmatch.arena.model.GameStatus;
import com.chessmatch.arena.model.PageSpec;
import com.chessmatch.arena.service.GameService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/games")
@RequiredArgsConstructor
@Validated
public class GameController {

  private final GameService gameService;

  @GetMapping
  public List<GameResponse> list(
      @RequestParam(value = "game_id", required = false) Long gameId,
      @RequestParam(value = "invitation_id", required = false) Long invitationId,
      @RequestParam(value = "player1_id", required = false) Long player1Id,
      @RequestParam(value = "player2_id", required = false) Long player2Id,
      @RequestParam(value = "whomst_id", required = false) Long whomstId,
      @RequestParam(value = "winner_id", required = false) Long winnerId,
      @RequestParam(value = "status", required = false) GameStatus status,
      @RequestParam(value = "reverse", defaultValue = "false") boolean reverse,
      @RequestParam(value = "skip", defaultValue = "0") @Min(0) int skip,
      @RequestParam(value = "limit", defaultValue = "10") @Min(1) @Max(PageSpec.MAX_LIMIT)
          int limit) {
    final GameFilter filter =
        new GameFilter(gameId, invitationId, player1Id, player2Id, whomstId, winnerId, status);
    return gameService.list(filter, new PageSpec(skip, limit, reverse)).stream()
        .map(GameResponse::from)
        .toList();
  }

  @PostMapping("/{gameId}/move")
  public GameResponse move(
      Authentication authentication,
      @PathVariable("gameId") long gameId,
      @Valid @RequestBody MoveRequest request) {
    return GameResponse.from(
        gameService.move(gameId, AuthenticatedUser.id(authentication), request.move().trim()));
  }

  @PostMapping("/{gameId}/forfeit")
  public GameResponse forfeit(
      Authentication authentication, @PathVariable("gameId") long gameId) {
    return GameResponse.from(gameService.forfeit(gameId, AuthenticatedUser.id(authentication)));
  }

  @PostMapping("/{gameId}/suggestion")
  public SuggestionResponse suggest(
      Authentication authentication, @PathVariable("gameId") long gameId) {
    return new SuggestionResponse(
        gameService.suggest(gameId, AuthenticatedUser.id(authentication)));
  }
}
