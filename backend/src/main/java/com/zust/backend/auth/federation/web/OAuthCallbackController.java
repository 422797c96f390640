package com.zust.backend.auth.federation.web;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.zust.backend.auth.federation.IdentityFederationBroker;
import com.zust.backend.auth.federation.service.FederatedAccountService.FederatedLogin;
import com.zust.backend.auth.identity.login.dto.AuthSessionResponse;
import com.zust.backend.media.support.MediaLinks;

import lombok.RequiredArgsConstructor;

/**
 * GET /oauth2/callback?code=...&state={provider tag}
 *
 * First sign-in and later sign-ins answer the same way: the account summary plus a token pair.
 */
@RestController
@RequiredArgsConstructor
public class OAuthCallbackController {

    private final IdentityFederationBroker broker;
    private final MediaLinks mediaLinks;

    @GetMapping("/oauth2/callback")
    public AuthSessionResponse callback(@RequestParam(name = "code", required = false) String code,
                                        @RequestParam(name = "state", required = false) String state) {
        FederatedLogin login = broker.handleCallback(state, code);
        return AuthSessionResponse.of(login.account(), mediaLinks.avatarLink(login.account().getId()), login.tokens());
    }
}
