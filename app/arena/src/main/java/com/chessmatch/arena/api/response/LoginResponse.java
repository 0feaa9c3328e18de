package com.chessmatch.arena.api.response;

public record LoginResponse(String token) {}
