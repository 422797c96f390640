package com.zust.backend.auth;

import java.time.Clock;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;

import com.zust.backend.account.repo.SubscriptionRepository;
import com.zust.backend.auth.credential.CredentialHasher;
import com.zust.backend.auth.domain.Account;
import com.zust.backend.auth.repo.AccountRepository;
import com.zust.backend.infra.AbstractIntegrationTest;
import com.zust.backend.infra.StubOAuthProvider;

/**
 * Common base of the auth integration tests.
 *
 * Every test starts from empty account and subscription tables, a fresh mail mock and an empty stub provider.
 */
public abstract class AbstractAuthIntegrationTest extends AbstractIntegrationTest {

    protected static final String EMAIL = "anna@zust.test";
    protected static final String USERNAME = "anna";
    protected static final String PASSWORD = "correct-horse-battery";

    @Autowired protected AccountRepository accountRepository;
    @Autowired protected SubscriptionRepository subscriptionRepository;
    @Autowired protected CredentialHasher credentialHasher;
    @Autowired protected StubOAuthProvider stubOAuthProvider;
    @Autowired protected Clock clock;

    @BeforeEach
    void resetAuthData() {
        subscriptionRepository.deleteAllInBatch();
        accountRepository.deleteAll();
        stubOAuthProvider.reset();
    }

    // INACTIVE password account, as left behind by /auth/register
    protected Account createInactiveUser(String email, String username, String rawPassword) {
        return accountRepository.saveAndFlush(
                Account.withPassword(email, username, credentialHasher.hash(rawPassword), clock.instant()));
    }

    protected Account createActiveUser(String email, String username, String rawPassword) {
        Account account = Account.withPassword(email, username, credentialHasher.hash(rawPassword), clock.instant());
        account.activate();
        return accountRepository.saveAndFlush(account);
    }

    protected Account createDefaultActiveUser() {
        return createActiveUser(EMAIL, USERNAME, PASSWORD);
    }

    protected Account reload(Account account) {
        return accountRepository.findById(account.getId()).orElseThrow();
    }

    protected static String uniqueEmail(String prefix) {
        return prefix + "_" + System.nanoTime() % 1_000_000 + "@zust.test";
    }
}
