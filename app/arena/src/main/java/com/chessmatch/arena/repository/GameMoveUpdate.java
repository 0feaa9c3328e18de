package com.chessmatch.arena.repository;

import com.chessmatch.arena.model.GameStatus;
import java.time.Instant;

/** {@link GameRepository#applyMove} の比較対象 (mover, previousFen) と更新値. */
public record GameMoveUpdate(
    long gameId,
    long moverId,
    String previousFen,
    String fen,
    String states,
    long nextWhomstId,
    GameStatus status,
    Long winnerId,
    Instant dateEnded) {}
