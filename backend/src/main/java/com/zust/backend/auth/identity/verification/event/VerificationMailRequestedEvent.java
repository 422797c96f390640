package com.zust.backend.auth.identity.verification.event;

/**
 * A verification link has to be mailed. Published inside the registering (or resending)
 * transaction and handled after it commits.
 */
public record VerificationMailRequestedEvent(String email, String username, String token) {}
