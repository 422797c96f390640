package com.zust.backend.security.session;

/**
 * Access/refresh pair minted at the same token_version.
 */
public record IssuedTokens(String accessToken, String refreshToken, int version) {
}
