package com.zust.backend.auth.credential;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * One-way password hashing on top of the BCrypt {@link PasswordEncoder}.
 *
 * verify() never throws for a bad digest: a malformed or missing digest is simply a mismatch,
 * so login flows can treat it like a wrong password.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialHasher {

    private final PasswordEncoder passwordEncoder;

    public String hash(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new IllegalArgumentException("plaintext must not be empty");
        }
        return passwordEncoder.encode(plaintext);
    }

    public boolean verify(String digest, String plaintext) {
        if (digest == null || digest.isBlank() || plaintext == null) {
            return false;
        }
        try {
            return passwordEncoder.matches(plaintext, digest);
        } catch (IllegalArgumentException e) {
            log.warn("Stored password digest could not be parsed: {}", e.getMessage());
            return false;
        }
    }
}
