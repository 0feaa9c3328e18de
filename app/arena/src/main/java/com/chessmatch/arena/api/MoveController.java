package com.chessmatch.arena.api;

import com.chessmatch.arena.api.response.MoveResponse;
import com.chessmatch.arena.model.MoveFilter;
import com.chessmatch.arena.model.PageSpec;
import com.chessmatch.arena.service.GameService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** 着手履歴. 既定は古い順 (棋譜の再生順). */
@RestController
@RequestMapping("/moves")
@RequiredArgsConstructor
@Validated
public class MoveController {

  private final GameService gameService;

  @GetMapping
  public List<MoveResponse> list(
      @RequestParam(value = "move_id", required = false) Long moveId,
      @RequestParam(value = "user_id", required = false) Long userId,
      @RequestParam(value = "game_id", required = false) Long gameId,
      @RequestParam(value = "reverse", defaultValue = "false") boolean reverse,
      @RequestParam(value = "skip", defaultValue = "0") @Min(0) int skip,
      @RequestParam(value = "limit", defaultValue = "10") @Min(1) @Max(PageSpec.MAX_LIMIT)
          int limit) {
    return gameService
        .listMoves(new MoveFilter(moveId, userId, gameId), new PageSpec(skip, limit, reverse))
        .stream()
        .map(MoveResponse::from)
        .toList();
  }
}
