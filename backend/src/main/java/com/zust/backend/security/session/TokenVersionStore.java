package com.zust.backend.security.session;

import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.zust.backend.auth.repo.AccountRepository;

import lombok.RequiredArgsConstructor;

/**
 * Per-account token_version, read and moved forward atomically by the database.
 *
 * This bean owns the transaction boundary of every version access. A caller without a
 * transaction gets a fresh one, a caller inside one (account lock) joins it. Failures to
 * open the transaction ({@code TransactionException}) and to run the statement
 * ({@code DataAccessException}) both reach the caller untranslated; {@link SessionAuthority}
 * sits outside this proxy and decides how they surface.
 */
@Component
@RequiredArgsConstructor
public class TokenVersionStore {

    private final AccountRepository accountRepository;

    @Transactional(readOnly = true)
    public Optional<Integer> current(UUID accountId) {
        return accountRepository.findTokenVersionById(accountId);
    }

    /** @return true if the account existed and its version moved forward */
    @Transactional
    public boolean increment(UUID accountId) {
        return accountRepository.incrementTokenVersion(accountId) == 1;
    }

    /** @return true only if the stored version was still {@code expected} */
    @Transactional
    public boolean incrementIfCurrent(UUID accountId, int expected) {
        return accountRepository.incrementTokenVersionIfCurrent(accountId, expected) == 1;
    }
}
