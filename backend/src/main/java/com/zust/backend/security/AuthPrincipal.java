package com.zust.backend.security;

import java.util.UUID;

import com.zust.backend.auth.domain.AccountRole;
import com.zust.backend.security.token.TokenKind;

/**
 * Authenticated caller as stored in the SecurityContext and injected into controllers
 * with {@code @AuthenticationPrincipal}.
 *
 * version is the token_version the presented token was minted with; it already matched the
 * stored value when the principal was created.
 */
public record AuthPrincipal(UUID accountId, AccountRole role, TokenKind kind, int version) {

    public AuthPrincipal {
        if (accountId == null) throw new IllegalArgumentException("accountId must not be null");
        if (role == null) throw new IllegalArgumentException("role must not be null");
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
    }

    /** Spring Security authority (ROLE_*) */
    public String authority() {
        return "ROLE_" + role.name();
    }
}
