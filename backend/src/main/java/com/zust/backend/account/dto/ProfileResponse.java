package com.zust.backend.account.dto;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

import com.zust.backend.auth.domain.Account;

/** Public view of an account: no email, no role, no credentials. */
public record ProfileResponse(
        UUID id,
        String username,
        String description,
        String avatar,
        String cover,
        long subscribers,
        Instant createdAt
) {

    public static ProfileResponse from(Account account, String avatarLink, String coverLink, long subscribers) {
        Objects.requireNonNull(account, "account must not be null");

        return new ProfileResponse(
                account.getId(),
                account.getUsername(),
                account.getDescription(),
                avatarLink,
                coverLink,
                subscribers,
                account.getCreatedAt()
        );
    }
}
