package com.chessmatch.arena.api.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record SignupRequest(
    @NotBlank(message = "name is required")
        @Size(min = 3, max = 15, message = "name must be 3-15 characters")
        @Pattern(
            regexp = "^[a-zA-Z0-9_-]+$",
            message = "name may only contain letters, digits, '_' and '-'")
        String name,
    @NotBlank(message = "email is required")
        @Email(message = "email is invalid")
        @Size(max = 320, message = "email is too long")
        String email,
    @PasswordPolicy String password) {}
