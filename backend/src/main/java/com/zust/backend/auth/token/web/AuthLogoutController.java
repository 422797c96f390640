package com.zust.backend.auth.token.web;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.zust.backend.global.MessageResponse;
import com.zust.backend.security.AuthPrincipal;
import com.zust.backend.security.session.SessionAuthority;

import lombok.RequiredArgsConstructor;

/**
 * POST /auth/logout: ends every session of the caller's account, on all devices.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthLogoutController {

    private final SessionAuthority sessionAuthority;

    @PostMapping("/logout")
    public MessageResponse logout(@AuthenticationPrincipal AuthPrincipal principal) {
        sessionAuthority.invalidate(principal.accountId());
        return MessageResponse.of("Logged out successfully");
    }
}
