package com.zust.backend.account.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

// POST and DELETE /subscribe
public record SubscriptionRequest(
        @NotNull UUID subscriberId,
        @NotNull UUID subscribeToId
) {}
