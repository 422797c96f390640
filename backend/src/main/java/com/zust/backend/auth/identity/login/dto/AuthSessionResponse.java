package com.zust.backend.auth.identity.login.dto;

import java.util.UUID;

import com.zust.backend.auth.domain.Account;
import com.zust.backend.security.session.IssuedTokens;

/**
 * Body of a successful password or OAuth login.
 *
 * - avatar: public media link of the account avatar
 * - accessToken: sent as {@code Authorization: Bearer} on every request
 * - refreshToken: only accepted by POST /auth/token/refresh
 */
public record AuthSessionResponse(
        UUID id,
        String username,
        String email,
        String avatar,
        String accessToken,
        String refreshToken
) {

    public static AuthSessionResponse of(Account account, String avatarLink, IssuedTokens tokens) {
        return new AuthSessionResponse(
                account.getId(),
                account.getUsername(),
                account.getEmail(),
                avatarLink,
                tokens.accessToken(),
                tokens.refreshToken()
        );
    }
}
