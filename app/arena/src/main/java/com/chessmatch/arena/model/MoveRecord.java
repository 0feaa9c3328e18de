package com.chessmatch.arena.model;

import java.time.Instant;

public record MoveRecord(
    long id, long userId, long gameId, Instant timestamp, String movestr, String fen) {}
