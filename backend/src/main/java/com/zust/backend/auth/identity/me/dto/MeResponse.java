package com.zust.backend.auth.identity.me.dto;

import java.util.Objects;
import java.util.UUID;

import com.zust.backend.auth.domain.Account;

public record MeResponse(
        UUID id,
        String email,
        String username,
        String description,
        String avatar,
        String role,
        String status
) {

    public static MeResponse from(Account account, String avatarLink) {
        Objects.requireNonNull(account, "account must not be null");

        return new MeResponse(
                account.getId(),
                account.getEmail(),
                account.getUsername(),
                account.getDescription(),
                avatarLink,
                account.getRole().name(),
                account.getStatus().name()
        );
    }
}
