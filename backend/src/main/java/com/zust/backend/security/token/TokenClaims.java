package com.zust.backend.security.token;

import java.time.Instant;
import java.util.UUID;

import com.zust.backend.auth.domain.AccountRole;

/**
 * Verified content of a bearer token.
 */
public record TokenClaims(
        UUID subject,
        AccountRole role,
        TokenKind kind,
        int version,
        Instant issuedAt,
        Instant expiresAt
) {
}
