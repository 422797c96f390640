package com.zust.backend.media.event;

import java.util.UUID;

/**
 * Published inside the transaction that inserted a new account.
 * avatarUrl is the external avatar for OAuth sign-ups, null for password sign-ups.
 */
public record AccountCreatedEvent(UUID accountId, String avatarUrl) {}
