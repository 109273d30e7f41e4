package com.meddiag.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "username_required")
        @Size(min = 3, max = 50, message = "username_length")
        @Pattern(regexp = "^[A-Za-z0-9_.-]+$", message = "username_charset")
        String username,
        @NotBlank(message = "password_required")
        @Size(min = 6, max = 100, message = "password_length")
        String password
) {
}
