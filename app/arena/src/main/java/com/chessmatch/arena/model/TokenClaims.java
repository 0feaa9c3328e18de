package com.chessmatch.arena.model;

import java.time.Instant;

public record TokenClaims(long userId, String userName, Instant issuedAt, Instant expiresAt) {}
