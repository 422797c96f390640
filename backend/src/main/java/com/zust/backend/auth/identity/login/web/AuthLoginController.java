package com.zust.backend.auth.identity.login.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.zust.backend.auth.identity.login.dto.AuthSessionResponse;
import com.zust.backend.auth.identity.login.dto.LoginRequest;
import com.zust.backend.auth.identity.login.service.LoginService;
import com.zust.backend.auth.identity.login.service.LoginService.LoginResult;
import com.zust.backend.media.support.MediaLinks;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthLoginController {

    private final LoginService loginService;
    private final MediaLinks mediaLinks;

    @PostMapping("/login")
    public AuthSessionResponse login(@Valid @RequestBody LoginRequest req) {
        LoginResult result = loginService.login(req.username(), req.password());
        return AuthSessionResponse.of(result.account(), mediaLinks.avatarLink(result.account().getId()), result.tokens());
    }
}
