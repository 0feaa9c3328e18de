package com.chessmatch.arena.api.response;

public record SuggestionResponse(String move) {}
