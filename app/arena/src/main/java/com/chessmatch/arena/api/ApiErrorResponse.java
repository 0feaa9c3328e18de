package com.chessmatch.arena.api;

public record ApiErrorResponse(String code, String message) {}
