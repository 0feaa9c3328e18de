package com.chessmatch.arena.service.dto;

import com.fasterxml.jackson.databind.JsonNode;

public record ChessWorkersMoveRequest(String fen, String move, JsonNode states) {}
