package com.zust.backend.auth.identity.login.dto;

import jakarta.validation.constraints.NotBlank;

public record LoginRequest(
        @NotBlank String username,
        @NotBlank String password
) {
    public LoginRequest {
        username = username == null ? null : username.strip();
    }
}
