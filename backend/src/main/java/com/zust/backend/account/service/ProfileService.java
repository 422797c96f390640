package com.zust.backend.account.service;

import java.util.UUID;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.zust.backend.account.dto.ProfileResponse;
import com.zust.backend.account.dto.ProfileUpdateRequest;
import com.zust.backend.account.repo.SubscriptionRepository;
import com.zust.backend.auth.domain.Account;
import com.zust.backend.auth.repo.AccountConstraints;
import com.zust.backend.auth.repo.AccountRepository;
import com.zust.backend.global.ApiException;
import com.zust.backend.global.ErrorCode;
import com.zust.backend.media.support.MediaLinks;
import com.zust.backend.media.support.MediaType;
import com.zust.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Public profile read and self-service profile edit.
 *
 * - read: anyone, ACTIVE accounts only (404 unknown, 403 not active)
 * - edit: the token's own account only, username and description; a field left out keeps its value
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileService {

    private final AccountRepository accountRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final MediaLinks mediaLinks;

    @Transactional(readOnly = true)
    public ProfileResponse get(UUID accountId) {
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new ApiException(ErrorCode.PROFILE_NOT_FOUND));

        if (!account.isActive()) {
            throw new ApiException(ErrorCode.ACCOUNT_NOT_ACTIVE);
        }
        return toResponse(account);
    }

    @Transactional
    public ProfileResponse update(AuthPrincipal principal, UUID accountId, ProfileUpdateRequest request) {
        if (!principal.accountId().equals(accountId)) {
            throw new ApiException(ErrorCode.ACCOUNT_ID_MISMATCH);
        }

        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new ApiException(ErrorCode.ACCOUNT_NOT_FOUND));

        if (!account.isActive()) {
            throw new ApiException(ErrorCode.ACCOUNT_NOT_ACTIVE);
        }

        String username = request.username();
        // the column collation ignores case, so the lookup may find this very account
        if (username != null && accountRepository.findByUsername(username)
                .filter(other -> !other.getId().equals(accountId))
                .isPresent()) {
            throw new ApiException(ErrorCode.USERNAME_ALREADY_TAKEN);
        }

        account.editProfile(username, request.description());
        try {
            accountRepository.flush();
        } catch (DataIntegrityViolationException e) {
            // the name was taken between the check and the flush
            if (AccountConstraints.violatedUniqueKey(e).filter(Account.UQ_USERNAME::equals).isPresent()) {
                throw new ApiException(ErrorCode.USERNAME_ALREADY_TAKEN);
            }
            throw e;
        }

        log.info("Profile edited. accountId={}", accountId);
        return toResponse(account);
    }

    private ProfileResponse toResponse(Account account) {
        UUID id = account.getId();
        return ProfileResponse.from(account,
                mediaLinks.avatarLink(id),
                mediaLinks.link(id, MediaType.COVER, null),
                subscriptionRepository.countBySubscribeToId(id));
    }
}
