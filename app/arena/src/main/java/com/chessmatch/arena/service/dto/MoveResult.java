package com.chessmatch.arena.service.dto;

/** chess-workers が受理した着手の結果. states は JSON 文字列で保持する. */
public record MoveResult(String status, String fen, String states) {}
