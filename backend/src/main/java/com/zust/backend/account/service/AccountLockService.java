package com.zust.backend.account.service;

import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.zust.backend.auth.domain.Account;
import com.zust.backend.auth.repo.AccountRepository;
import com.zust.backend.global.ApiException;
import com.zust.backend.global.ErrorCode;
import com.zust.backend.security.AuthPrincipal;
import com.zust.backend.security.session.SessionAuthority;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Self-service lock: the account goes LOCKED and its token version moves in the same
 * transaction, so no outstanding token survives the lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountLockService {

    private final AccountRepository accountRepository;
    private final SessionAuthority sessionAuthority;

    @Transactional
    public void lock(AuthPrincipal principal, UUID accountId) {
        if (!principal.accountId().equals(accountId)) {
            throw new ApiException(ErrorCode.ACCOUNT_ID_MISMATCH);
        }

        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new ApiException(ErrorCode.ACCOUNT_NOT_FOUND));

        if (!account.isActive()) {
            throw new ApiException(ErrorCode.ACCOUNT_STATUS_CONFLICT, "Account is " + account.getStatus().label());
        }

        account.lock();
        sessionAuthority.invalidate(accountId);

        log.info("Account locked. accountId={}", accountId);
    }
}
