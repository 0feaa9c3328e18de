package com.chessmatch.arena.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChessWorkersMoveResponse(String status, String fen, JsonNode states) {}
