package com.zust.backend.account.service;

import java.time.Clock;
import java.util.UUID;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.zust.backend.account.domain.Subscription;
import com.zust.backend.account.dto.SubscriptionRequest;
import com.zust.backend.account.dto.SubscriptionResponse;
import com.zust.backend.account.repo.SubscriptionRepository;
import com.zust.backend.auth.domain.Account;
import com.zust.backend.auth.repo.AccountRepository;
import com.zust.backend.global.ApiException;
import com.zust.backend.global.ErrorCode;
import com.zust.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Subscribe / unsubscribe on behalf of the token's own account.
 *
 * Both directions require subscriberId == token subject and an ACTIVE subscriber.
 * Subscribing needs an ACTIVE target other than yourself; unsubscribing an absent pair is a no-op.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionService {

    private final SubscriptionRepository subscriptionRepository;
    private final AccountRepository accountRepository;
    private final Clock clock;

    @Transactional
    public SubscriptionResponse subscribe(AuthPrincipal principal, SubscriptionRequest request) {
        UUID subscriberId = request.subscriberId();
        UUID targetId = request.subscribeToId();
        requireActiveCaller(principal, subscriberId);

        if (subscriberId.equals(targetId)) {
            throw new ApiException(ErrorCode.SUBSCRIBE_SELF);
        }

        boolean targetActive = accountRepository.findById(targetId)
                .map(Account::isActive)
                .orElse(false);
        if (!targetActive) {
            throw new ApiException(ErrorCode.SUBSCRIPTION_TARGET_NOT_FOUND);
        }

        if (subscriptionRepository.existsById(new Subscription.Key(subscriberId, targetId))) {
            throw new ApiException(ErrorCode.ALREADY_SUBSCRIBED);
        }

        Subscription saved;
        try {
            saved = subscriptionRepository.saveAndFlush(Subscription.of(subscriberId, targetId, clock.instant()));
        } catch (DataIntegrityViolationException e) {
            // same pair inserted concurrently; the primary key is the only unique key
            throw new ApiException(ErrorCode.ALREADY_SUBSCRIBED);
        }

        log.info("Subscribed. subscriberId={}, subscribeToId={}", subscriberId, targetId);
        return SubscriptionResponse.from(saved);
    }

    @Transactional
    public void unsubscribe(AuthPrincipal principal, SubscriptionRequest request) {
        requireActiveCaller(principal, request.subscriberId());

        int removed = subscriptionRepository.deletePair(request.subscriberId(), request.subscribeToId());
        log.info("Unsubscribed. subscriberId={}, subscribeToId={}, removed={}",
                request.subscriberId(), request.subscribeToId(), removed);
    }

    private void requireActiveCaller(AuthPrincipal principal, UUID subscriberId) {
        if (!principal.accountId().equals(subscriberId)) {
            throw new ApiException(ErrorCode.ACCOUNT_ID_MISMATCH);
        }

        Account subscriber = accountRepository.findById(subscriberId)
                .orElseThrow(() -> new ApiException(ErrorCode.ACCOUNT_NOT_FOUND));
        if (!subscriber.isActive()) {
            throw new ApiException(ErrorCode.ACCOUNT_NOT_ACTIVE);
        }
    }
}
