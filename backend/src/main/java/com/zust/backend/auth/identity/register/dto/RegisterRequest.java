package com.zust.backend.auth.identity.register.dto;

import com.zust.backend.auth.domain.Account;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(

        @NotBlank
        @Email
        @Size(max = Account.EMAIL_MAX_LENGTH)
        String email,

        @NotBlank
        @Size(max = Account.USERNAME_MAX_LENGTH)
        String username,

        // BCrypt only reads the first 72 bytes
        @NotBlank
        @Size(max = 72)
        String password
) {
    // email and username are stored stripped; the password is taken as typed
    public RegisterRequest {
        email = email == null ? null : email.strip();
        username = username == null ? null : username.strip();
    }
}
