/*
 * どこで: Arena API
 * 何を: 招待の作成/一覧/accept/decline/cancel を公開する
 * なぜ: 操作者をトークン由来の user id に固定し、本文や URL からなりすませないようにするため
 */
package com.chessmatch.arena.api;

import com.chessmatch.arena.api.request.CreateInvitationRequest;
import com.chessmatch.arena.api.response.AcceptInvitationResponse;
import com.chessmatch.arena.api.response.InvitationResponse;
import com.chessmatch.arena.model.GameType;
import com.chessmatch.arena.model.InvitationFilter;
import com.chessmatch.arena.model.InvitationStatus;
import com.chessmatch.arena.model.PageSpec;
import com.chessmatch.arena.service.InvitationService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/invitations")
@RequiredArgsConstructor
@Validated
public class InvitationController {

  private final InvitationService invitationService;

  @PostMapping
  public ResponseEntity<InvitationResponse> create(
      Authentication authentication, @Valid @RequestBody CreateInvitationRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            InvitationResponse.from(
                invitationService.create(
                    AuthenticatedUser.id(authentication), request.toId(), request.gameType())));
  }

  @GetMapping
  public List<InvitationResponse> list(
      Authentication authentication,
      @RequestParam(value = "invitation_id", required = false) Long invitationId,
      @RequestParam(value = "from_id", required = false) Long fromId,
      @RequestParam(value = "to_id", required = false) Long toId,
      @RequestParam(value = "status", required = false) InvitationStatus status,
      @RequestParam(value = "game_type", required = false) GameType gameType,
      @RequestParam(value = "reverse", defaultValue = "false") boolean reverse,
      @RequestParam(value = "skip", defaultValue = "0") @Min(0) int skip,
      @RequestParam(value = "limit", defaultValue = "10") @Min(1) @Max(PageSpec.MAX_LIMIT)
          int limit) {
    final InvitationFilter filter =
        new InvitationFilter(invitationId, fromId, toId, status, gameType);
    return invitationService
        .list(AuthenticatedUser.id(authentication), filter, new PageSpec(skip, limit, reverse))
        .stream()
        .map(InvitationResponse::from)
        .toList();
  }

  @PutMapping("/{invitationId}/accept")
  public AcceptInvitationResponse accept(
      Authentication authentication, @PathVariable("invitationId") long invitationId) {
    return new AcceptInvitationResponse(
        invitationService.accept(AuthenticatedUser.id(authentication), invitationId).id());
  }

  @PutMapping("/{invitationId}/decline")
  public InvitationResponse decline(
      Authentication authentication, @PathVariable("invitationId") long invitationId) {
    return InvitationResponse.from(
        invitationService.decline(AuthenticatedUser.id(authentication), invitationId));
  }

  @PutMapping("/{invitationId}/cancel")
  public InvitationResponse cancel(
      Authentication authentication, @PathVariable("invitationId") long invitationId) {
    return InvitationResponse.from(
        invitationService.cancel(AuthenticatedUser.id(authentication), invitationId));
  }
}
