package com.zust.backend.auth.identity.me.service;

import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.zust.backend.auth.domain.Account;
import com.zust.backend.auth.identity.me.dto.MeResponse;
import com.zust.backend.auth.repo.AccountRepository;
import com.zust.backend.global.ApiException;
import com.zust.backend.global.ErrorCode;
import com.zust.backend.media.support.MediaLinks;
import com.zust.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

/**
 * Summary of the calling account.
 *
 * - no principal: AUTH_REQUIRED (normally stopped by the entry point already)
 * - account gone: ACCOUNT_NOT_FOUND
 * - account not ACTIVE: ACCOUNT_NOT_ACTIVE
 */
@Service
@RequiredArgsConstructor
public class MeService {

    private final AccountRepository accountRepository;
    private final MediaLinks mediaLinks;

    @Transactional(readOnly = true)
    public MeResponse me(AuthPrincipal principal) {
        if (principal == null) {
            throw new ApiException(ErrorCode.AUTH_REQUIRED);
        }

        UUID accountId = principal.accountId();
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new ApiException(ErrorCode.ACCOUNT_NOT_FOUND));

        if (!account.isActive()) {
            throw new ApiException(ErrorCode.ACCOUNT_NOT_ACTIVE);
        }

        return MeResponse.from(account, mediaLinks.avatarLink(accountId));
    }
}
