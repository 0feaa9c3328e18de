package com.chessmatch.arena.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChessWorkersErrorResponse(String message) {}
