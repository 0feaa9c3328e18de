/*
 * どこで: Arena サービス層
 * 何を: 招待の作成/一覧と accept/decline/cancel の状態遷移を行う
 * なぜ: 未検出 → 当事者 → 送信者の生存 → 状態 の順で検査し、遷移は DB の条件付き更新で確定させるため
 */
package com.chessmatch.arena.service;

import com.chessmatch.arena.api.ActionForbiddenException;
import com.chessmatch.arena.api.InvalidRequestException;
import com.chessmatch.arena.api.ResourceNotFoundException;
import com.chessmatch.arena.api.StateConflictException;
import com.chessmatch.arena.model.GameRecord;
import com.chessmatch.arena.model.GameType;
import com.chessmatch.arena.model.InvitationEvent;
import com.chessmatch.arena.model.InvitationFilter;
import com.chessmatch.arena.model.InvitationRecord;
import com.chessmatch.arena.model.InvitationStatus;
import com.chessmatch.arena.model.PageSpec;
import com.chessmatch.arena.model.UserRecord;
import com.chessmatch.arena.repository.GameRepository;
import com.chessmatch.arena.repository.InvitationRepository;
import com.chessmatch.arena.repository.UserRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class InvitationService {

  private static final Logger logger = LoggerFactory.getLogger(InvitationService.class);

  private final InvitationRepository invitationRepository;
  private final UserRepository userRepository;
  private final GameRepository gameRepository;
  private final ArenaMetrics metrics;
  private final Clock clock;

  @Transactional
  public InvitationRecord create(long actorId, long toId, GameType gameType) {
    if (actorId == toId) {
      throw new InvalidRequestException("cannot invite self");
    }
    final UserRecord recipient =
        userRepository
            .findById(toId)
            .orElseThrow(() -> new InvalidRequestException("addressee does not exist"));
    if (recipient.deleted()) {
      throw new InvalidRequestException("user '" + toId + "' has been deleted");
    }
    final InvitationRecord created =
        invitationRepository.insert(actorId, toId, gameType, clock.instant());
    logger.info("invitation created invitationId={} from={} to={}", created.id(), actorId, toId);
    return created;
  }

  public List<InvitationRecord> list(long actorId, InvitationFilter filter, PageSpec page) {
    if (filter.toId() == null && filter.fromId() == null) {
      throw new InvalidRequestException("'to_id' or 'from_id' must be supplied");
    }
    if (!Objects.equals(filter.toId(), actorId) && !Objects.equals(filter.fromId(), actorId)) {
      throw new ActionForbiddenException(
          "user with ID '" + actorId + "' may only list invitations sent to or from themself");
    }
    return invitationRepository.list(filter, page);
  }

  /** 招待を受諾し、同一トランザクションで対局を作成する. 作成した対局を返す. */
  @Transactional
  public GameRecord accept(long actorId, long invitationId) {
    final InvitationRecord accepted = transition(actorId, invitationId, InvitationEvent.ACCEPT);
    final GameRecord game =
        gameRepository.insert(
            accepted.id(),
            accepted.gameType(),
            accepted.fromId(),
            accepted.toId(),
            accepted.dateAnswered(),
            GameService.INITIAL_FEN,
            GameService.INITIAL_STATES);
    logger.info("game created gameId={} invitationId={}", game.id(), accepted.id());
    return game;
  }

  @Transactional
  public InvitationRecord decline(long actorId, long invitationId) {
    return transition(actorId, invitationId, InvitationEvent.DECLINE);
  }

  @Transactional
  public InvitationRecord cancel(long actorId, long invitationId) {
    return transition(actorId, invitationId, InvitationEvent.CANCEL);
  }

  private InvitationRecord transition(long actorId, long invitationId, InvitationEvent event) {
    final String eventName = event.name().toLowerCase(Locale.ROOT);
    final InvitationRecord invitation =
        invitationRepository
            .findById(invitationId)
            .orElseThrow(
                () ->
                    new ResourceNotFoundException(
                        "invitation with ID '" + invitationId + "' does not exist"));

    if (invitation.participant(event.actor()) != actorId) {
      metrics.recordInvitationTransition(eventName, "forbidden");
      throw new ActionForbiddenException(
          "invitation with ID '"
              + invitationId
              + (event.actor() == InvitationEvent.Party.RECIPIENT
                  ? "' not addressed to user with ID '"
                  : "' not sent by user with ID '")
              + actorId
              + "'");
    }

    if (event.requiresLiveSender() && !isLive(invitation.fromId())) {
      metrics.recordInvitationTransition(eventName, "sender_deleted");
      throw new ResourceNotFoundException(
          "user with ID '"
              + invitation.fromId()
              + "' who sent invitation with id '"
              + invitationId
              + "' does not exist");
    }

    final InvitationStatus target =
        invitation
            .status()
            .transition(event)
            .orElseThrow(() -> alreadyAnswered(eventName, invitationId, invitation.status()));

    final Instant now = clock.instant();
    final Optional<InvitationRecord> updated =
        invitationRepository.transitionFromPending(invitationId, target, now);
    if (updated.isEmpty()) {
      // 読み込み後に別リクエストが先に遷移させた
      final InvitationStatus current =
          invitationRepository
              .findById(invitationId)
              .map(InvitationRecord::status)
              .orElse(invitation.status());
      throw alreadyAnswered(eventName, invitationId, current);
    }
    metrics.recordInvitationTransition(eventName, "success");
    logger.info(
        "invitation transitioned invitationId={} event={} status={}",
        invitationId,
        event,
        target);
    return updated.get();
  }

  private StateConflictException alreadyAnswered(
      String eventName, long invitationId, InvitationStatus current) {
    metrics.recordInvitationTransition(eventName, "conflict");
    return new StateConflictException(
        "invitation with ID '" + invitationId + "' already has '" + current + "' status",
        current.name());
  }

  private boolean isLive(long userId) {
    return userRepository.findById(userId).map(UserRecord::isActive).orElse(false);
  }
}
