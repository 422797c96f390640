package com.zust.backend.auth.federation;

/**
 * Profile reported by a provider. providerId is unique per provider and never changes;
 * the other fields are whatever the user set up there.
 */
public record ExternalIdentity(
        String providerId,
        String displayName,
        String avatarUrl,
        String email
) {}
