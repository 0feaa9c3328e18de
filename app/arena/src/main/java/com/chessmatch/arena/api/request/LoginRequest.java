package com.chessmatch.arena.api.request;

import jakarta.validation.constraints.NotBlank;

public record LoginRequest(
    @NotBlank(message = "name is required") String name,
    @NotBlank(message = "password is required") String password) {}
