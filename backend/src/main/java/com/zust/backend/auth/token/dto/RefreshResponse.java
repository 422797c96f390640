package com.zust.backend.auth.token.dto;

/**
 * New token pair. The refresh token that was presented is dead from now on.
 */
public record RefreshResponse(String accessToken, String refreshToken) {}
