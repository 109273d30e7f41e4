package com.meddiag.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record LoginRequest(
        @NotBlank(message = "username_required")
        @Size(min = 3, max = 50, message = "username_length")
        String username,
        @NotBlank(message = "password_required")
        @Size(min = 6, max = 100, message = "password_length")
        String password
) {
}
