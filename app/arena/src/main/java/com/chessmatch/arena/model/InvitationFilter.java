package com.chessmatch.arena.model;

public record InvitationFilter(
    Long id, Long fromId, Long toId, InvitationStatus status, GameType gameType) {}
