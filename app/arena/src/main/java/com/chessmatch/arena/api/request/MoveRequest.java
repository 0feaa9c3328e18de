package com.chessmatch.arena.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record MoveRequest(
    @NotBlank(message = "move is required") @Size(max = 16, message = "move is too long")
        String move) {}
