package com.zust.backend.account.dto;

import java.time.Instant;
import java.util.UUID;

import com.zust.backend.account.domain.Subscription;

public record SubscriptionResponse(UUID subscriberId, UUID subscribeToId, Instant subscribedAt) {

    public static SubscriptionResponse from(Subscription s) {
        return new SubscriptionResponse(s.getSubscriberId(), s.getSubscribeToId(), s.getSubscribedAt());
    }
}
