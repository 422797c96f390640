package com.zust.backend.account.dto;

import com.zust.backend.auth.domain.Account;

import jakarta.validation.constraints.Size;

/**
 * PUT /accounts/{id} body. A missing or blank field keeps the stored value.
 */
public record ProfileUpdateRequest(
        @Size(max = Account.USERNAME_MAX_LENGTH) String username,
        @Size(max = Account.DESCRIPTION_MAX_LENGTH) String description
) {
    public ProfileUpdateRequest {
        username = blankToNull(username);
        description = blankToNull(description);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.strip();
    }
}
