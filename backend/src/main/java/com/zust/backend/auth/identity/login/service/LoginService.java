package com.zust.backend.auth.identity.login.service;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.zust.backend.auth.credential.CredentialHasher;
import com.zust.backend.auth.domain.Account;
import com.zust.backend.auth.repo.AccountRepository;
import com.zust.backend.global.ApiException;
import com.zust.backend.global.ErrorCode;
import com.zust.backend.security.session.IssuedTokens;
import com.zust.backend.security.session.SessionAuthority;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Password login.
 *
 * - unknown username and wrong password share INVALID_CREDENTIALS
 * - OAuth-only accounts get PASSWORD_NOT_SET
 * - status is checked only after the password matched, so ACCOUNT_NOT_ACTIVE
 *   never reveals anything to a caller without the password
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginService {

    private final AccountRepository accountRepository;
    private final CredentialHasher credentialHasher;
    private final SessionAuthority sessionAuthority;

    @Transactional(readOnly = true)
    public LoginResult login(String username, String rawPassword) {
        if (isBlank(username) || isBlank(rawPassword)) {
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }

        Account account = accountRepository.findByUsername(username)
                .orElseThrow(() -> new ApiException(ErrorCode.INVALID_CREDENTIALS));

        if (!account.hasPassword()) {
            throw new ApiException(ErrorCode.PASSWORD_NOT_SET);
        }

        if (!credentialHasher.verify(account.getPasswordHash(), rawPassword)) {
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }

        IssuedTokens tokens = sessionAuthority.issue(account);
        log.info("Password login. accountId={}", account.getId());
        return new LoginResult(account, tokens);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public record LoginResult(Account account, IssuedTokens tokens) {
    }
}
