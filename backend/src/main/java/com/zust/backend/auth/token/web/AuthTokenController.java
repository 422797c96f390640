package com.zust.backend.auth.token.web;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.zust.backend.auth.token.dto.RefreshResponse;
import com.zust.backend.security.AuthPrincipal;
import com.zust.backend.security.session.IssuedTokens;
import com.zust.backend.security.session.SessionAuthority;

import lombok.RequiredArgsConstructor;

/**
 * POST /auth/token/refresh with {@code Authorization: Bearer <refresh token>}.
 *
 * The filter already checked signature, expiry, version and that a refresh token was sent.
 * Rotation bumps the version, so the presented refresh token and every access token of the
 * account stop working.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth/token")
public class AuthTokenController {

    private final SessionAuthority sessionAuthority;

    @PostMapping("/refresh")
    public RefreshResponse refresh(@AuthenticationPrincipal AuthPrincipal principal) {
        IssuedTokens tokens = sessionAuthority.refresh(principal);
        return new RefreshResponse(tokens.accessToken(), tokens.refreshToken());
    }
}
