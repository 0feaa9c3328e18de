package com.chessmatch.arena.service.dto;

import com.fasterxml.jackson.databind.JsonNode;

public record ChessWorkersSuggestRequest(String fen, JsonNode states) {}
