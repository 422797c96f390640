package com.zust.backend.auth.federation.service;

import java.time.Clock;
import java.util.Optional;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.zust.backend.auth.domain.Account;
import com.zust.backend.auth.federation.ExternalIdentity;
import com.zust.backend.auth.repo.AccountConstraints;
import com.zust.backend.auth.repo.AccountRepository;
import com.zust.backend.global.ApiException;
import com.zust.backend.global.ErrorCode;
import com.zust.backend.media.event.AccountCreatedEvent;
import com.zust.backend.security.session.IssuedTokens;
import com.zust.backend.security.session.SessionAuthority;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps a provider identity onto a local account, one transaction per attempt.
 *
 * (provider, providerId) known: login, the account must be ACTIVE.
 * Unknown: a new ACTIVE account is inserted with that identity and logged in. The provider email
 * must fit the email column and must not belong to another account; the username derived from
 * the display name must be free too.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FederatedAccountService {

    private final AccountRepository accountRepository;
    private final SessionAuthority sessionAuthority;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * @throws ConcurrentRegistrationException the insert collided with a concurrent one;
     *         this transaction is rolled back and the caller may simply retry
     */
    @Transactional
    public FederatedLogin loginOrRegister(String provider, ExternalIdentity identity) {
        Optional<Account> existing = findLinked(provider, identity);
        if (existing.isPresent()) {
            return login(provider, existing.get());
        }
        return register(provider, identity);
    }

    private FederatedLogin login(String provider, Account account) {
        IssuedTokens tokens = sessionAuthority.issue(account);
        log.info("OAuth login. provider={}, accountId={}", provider, account.getId());
        return new FederatedLogin(account, tokens, false);
    }

    private FederatedLogin register(String provider, ExternalIdentity identity) {
        String email = identity.email().trim();
        if (email.length() > Account.EMAIL_MAX_LENGTH) {
            log.warn("OAuth registration refused, email too long. provider={}, length={}", provider, email.length());
            throw new ApiException(ErrorCode.OAUTH_EMAIL_TOO_LONG);
        }
        String username = usernameFor(identity);

        ErrorCode conflict = accountRepository.existsByEmail(email) ? ErrorCode.EMAIL_ALREADY_TAKEN
                : accountRepository.existsByUsername(username) ? ErrorCode.USERNAME_ALREADY_TAKEN
                : null;
        if (conflict != null) {
            // a concurrent callback for this identity may have committed since the first lookup
            Optional<Account> linked = findLinked(provider, identity);
            if (linked.isPresent()) {
                return login(provider, linked.get());
            }
            throw new ApiException(conflict);
        }

        Account account;
        try {
            account = accountRepository.saveAndFlush(
                    Account.withExternalIdentity(email, username, provider, identity.providerId(), clock.instant()));
        } catch (DataIntegrityViolationException e) {
            // a unique key that was free when checked: a concurrent insert won, the retry's lookups sort out which
            if (AccountConstraints.violatedUniqueKey(e).isPresent()) {
                throw new ConcurrentRegistrationException(e);
            }
            throw e;
        }

        eventPublisher.publishEvent(new AccountCreatedEvent(account.getId(), identity.avatarUrl()));

        IssuedTokens tokens = sessionAuthority.issue(account);
        log.info("OAuth account created. provider={}, accountId={}", provider, account.getId());
        return new FederatedLogin(account, tokens, true);
    }

    private Optional<Account> findLinked(String provider, ExternalIdentity identity) {
        return accountRepository.findByOauthProviderAndOauthProviderId(provider, identity.providerId());
    }

    /**
     * Provider display names may be longer than a username allows, or missing.
     * Falls back to the email local part.
     */
    static String usernameFor(ExternalIdentity identity) {
        String name = identity.displayName();
        if (name == null || name.isBlank()) {
            String email = identity.email();
            int at = email.indexOf('@');
            name = at > 0 ? email.substring(0, at) : email;
        }
        name = name.trim();
        return name.length() > Account.USERNAME_MAX_LENGTH
                ? name.substring(0, Account.USERNAME_MAX_LENGTH)
                : name;
    }

    public record FederatedLogin(Account account, IssuedTokens tokens, boolean created) {
    }

    /** Insert hit a unique constraint that was free when checked. */
    public static class ConcurrentRegistrationException extends RuntimeException {
        ConcurrentRegistrationException(Throwable cause) {
            super("federated account insert collided with a concurrent insert", cause);
        }
    }
}
