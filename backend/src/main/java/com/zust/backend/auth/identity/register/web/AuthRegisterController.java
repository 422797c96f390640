package com.zust.backend.auth.identity.register.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.zust.backend.auth.identity.register.dto.RegisterRequest;
import com.zust.backend.auth.identity.register.service.RegistrationService;
import com.zust.backend.global.MessageResponse;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthRegisterController {

    private final RegistrationService registrationService;

    @PostMapping("/register")
    public MessageResponse register(@RequestBody @Valid RegisterRequest req) {
        registrationService.register(req.email(), req.username(), req.password());
        return MessageResponse.of("Account created successfully");
    }
}
