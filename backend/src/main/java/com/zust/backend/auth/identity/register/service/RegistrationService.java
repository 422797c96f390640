package com.zust.backend.auth.identity.register.service;

import java.time.Clock;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.zust.backend.auth.credential.CredentialHasher;
import com.zust.backend.auth.domain.Account;
import com.zust.backend.auth.identity.verification.event.VerificationMailRequestedEvent;
import com.zust.backend.auth.identity.verification.support.VerificationTokenCodec;
import com.zust.backend.auth.repo.AccountConstraints;
import com.zust.backend.auth.repo.AccountRepository;
import com.zust.backend.global.ApiException;
import com.zust.backend.global.ErrorCode;
import com.zust.backend.media.event.AccountCreatedEvent;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Password registration.
 *
 * The account starts INACTIVE. After commit the media listener creates its directory and
 * the verification mail goes out; a failure in either is logged and leaves the account in place.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegistrationService {

    private final AccountRepository accountRepository;
    private final CredentialHasher credentialHasher;
    private final VerificationTokenCodec verificationTokenCodec;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public Account register(String email, String username, String rawPassword) {
        // fast path; the unique constraints below are the real guard
        if (accountRepository.existsByEmail(email))
            throw new ApiException(ErrorCode.EMAIL_ALREADY_TAKEN);

        if (accountRepository.existsByUsername(username))
            throw new ApiException(ErrorCode.USERNAME_ALREADY_TAKEN);

        String hash = credentialHasher.hash(rawPassword);

        Account account;
        try {
            account = accountRepository.saveAndFlush(Account.withPassword(email, username, hash, clock.instant()));
        } catch (DataIntegrityViolationException e) {
            throw translateDuplicate(e);
        }

        eventPublisher.publishEvent(new AccountCreatedEvent(account.getId(), null));
        eventPublisher.publishEvent(new VerificationMailRequestedEvent(
                account.getEmail(),
                account.getUsername(),
                verificationTokenCodec.issue(account.getId())
        ));

        log.info("Account registered. accountId={}", account.getId());
        return account;
    }

    /**
     * Maps a lost insert race to the field that collided, by unique constraint name.
     * Anything else is not a duplicate and is rethrown as is.
     */
    static RuntimeException translateDuplicate(DataIntegrityViolationException e) {
        String key = AccountConstraints.violatedUniqueKey(e).orElse(null);

        if (Account.UQ_EMAIL.equals(key)) {
            return new ApiException(ErrorCode.EMAIL_ALREADY_TAKEN);
        }
        if (Account.UQ_USERNAME.equals(key)) {
            return new ApiException(ErrorCode.USERNAME_ALREADY_TAKEN);
        }
        return e;
    }
}
