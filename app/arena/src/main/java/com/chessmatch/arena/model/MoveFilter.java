package com.chessmatch.arena.model;

public record MoveFilter(Long id, Long userId, Long gameId) {}
