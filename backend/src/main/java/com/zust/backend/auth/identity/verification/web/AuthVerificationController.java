package com.zust.backend.auth.identity.verification.web;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.zust.backend.auth.identity.verification.service.VerificationService;
import com.zust.backend.global.MessageResponse;

import lombok.RequiredArgsConstructor;

/**
 * Email verification API. Both parameters are optional at the binding level so that a missing
 * value gets its own message instead of the generic one.
 */
@RestController
@RequestMapping("/auth/verification")
@RequiredArgsConstructor
public class AuthVerificationController {

    private final VerificationService verificationService;

    @GetMapping
    public MessageResponse verify(@RequestParam(name = "token", required = false) String token) {
        verificationService.verify(token);
        return MessageResponse.of("Account verified successfully");
    }

    @PostMapping("/resend")
    public MessageResponse resend(@RequestParam(name = "email", required = false) String email) {
        verificationService.resend(email);
        return MessageResponse.of("Verification email sent successfully");
    }
}
