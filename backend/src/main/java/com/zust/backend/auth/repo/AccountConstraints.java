package com.zust.backend.auth.repo;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.springframework.dao.DataIntegrityViolationException;

import com.zust.backend.auth.domain.Account;

/**
 * Reads which unique key of the account table an insert or update ran into.
 *
 * MySQL reports {@code Duplicate entry '...' for key 'account.uq_account_email'}; the name is
 * matched case-insensitively anywhere in the driver message.
 */
public final class AccountConstraints {

    private static final List<String> UNIQUE_KEYS = List.of(
            Account.UQ_EMAIL,
            Account.UQ_USERNAME,
            Account.UQ_OAUTH_IDENTITY
    );

    private AccountConstraints() {}

    /** @return the violated unique key, empty for anything else (data too long, CHECK, FK, ...) */
    public static Optional<String> violatedUniqueKey(DataIntegrityViolationException e) {
        String message = String.valueOf(e.getMostSpecificCause().getMessage()).toLowerCase(Locale.ROOT);

        // uq_account_email is not a prefix of another key name, so first match wins
        return UNIQUE_KEYS.stream()
                .filter(message::contains)
                .findFirst();
    }
}
