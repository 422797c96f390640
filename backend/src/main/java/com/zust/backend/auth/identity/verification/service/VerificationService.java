package com.zust.backend.auth.identity.verification.service;

import java.util.UUID;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.zust.backend.auth.domain.Account;
import com.zust.backend.auth.domain.AccountStatus;
import com.zust.backend.auth.identity.verification.event.VerificationMailRequestedEvent;
import com.zust.backend.auth.identity.verification.support.VerificationTokenCodec;
import com.zust.backend.auth.repo.AccountRepository;
import com.zust.backend.global.ApiException;
import com.zust.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Email verification.
 *
 * verify: INACTIVE → ACTIVE. Following the link again on an ACTIVE account is a no-op success.
 * BANNED and LOCKED accounts are never reactivated by a link.
 *
 * resend: only INACTIVE accounts get a new link.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationService {

    private final AccountRepository accountRepository;
    private final VerificationTokenCodec tokenCodec;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public void verify(String token) {
        UUID accountId = tokenCodec.parse(token);

        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new ApiException(ErrorCode.ACCOUNT_NOT_FOUND));

        switch (account.getStatus()) {
            case INACTIVE -> {
                account.activate();
                log.info("Account verified. accountId={}", accountId);
            }
            case ACTIVE -> log.debug("Verification link reused on active account. accountId={}", accountId);
            default -> throw statusConflict(account.getStatus());
        }
    }

    @Transactional(readOnly = true)
    public void resend(String email) {
        if (email == null || email.isBlank()) {
            throw new ApiException(ErrorCode.EMAIL_MISSING);
        }

        Account account = accountRepository.findByEmail(email.trim())
                .orElseThrow(() -> new ApiException(ErrorCode.EMAIL_NOT_REGISTERED));

        if (account.getStatus() != AccountStatus.INACTIVE) {
            throw statusConflict(account.getStatus());
        }

        eventPublisher.publishEvent(new VerificationMailRequestedEvent(
                account.getEmail(),
                account.getUsername(),
                tokenCodec.issue(account.getId())
        ));
    }

    private static ApiException statusConflict(AccountStatus status) {
        return new ApiException(ErrorCode.ACCOUNT_STATUS_CONFLICT, "Account is " + status.label());
    }
}
