package com.zust.backend.auth.federation;

import org.springframework.stereotype.Service;

import com.zust.backend.auth.federation.service.FederatedAccountService;
import com.zust.backend.auth.federation.service.FederatedAccountService.ConcurrentRegistrationException;
import com.zust.backend.auth.federation.service.FederatedAccountService.FederatedLogin;
import com.zust.backend.global.ApiException;
import com.zust.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * OAuth2 callback flow, provider side and account side.
 *
 * Steps:
 * - provider lookup by the state tag ("github", "google"): unknown → 400 OAUTH_UNKNOWN_PROVIDER
 * - code exchange: POST to the provider's token endpoint, gives a provider access token
 * - profile fetch: GET the user endpoint, gives an {@link ExternalIdentity}
 * - reconciliation: FederatedAccountService logs the identity in or creates its account
 *
 * Transactions:
 * - the two provider HTTP calls run outside any database transaction, a slow provider
 *   holds no connection
 * - reconciliation is one transaction per attempt
 *
 * Concurrency:
 * - two callbacks for the same new identity can both miss the lookup and both insert.
 *   The loser's insert hits a unique key and is retried exactly once; the retry either finds
 *   the identity linked and logs in, or reports the email or username conflict.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityFederationBroker {

    private final OAuthProviderRegistry registry;
    private final FederatedAccountService federatedAccountService;

    /**
     * @param providerTag the callback's state parameter
     * @param code        the one-time authorization code, never logged
     * @throws OAuthProviderException provider unreachable or answered with an error (500 OAUTH_EXCHANGE_FAILED / OAUTH_FETCH_FAILED)
     * @throws ApiException unknown provider, missing code, or an account conflict
     */
    public FederatedLogin handleCallback(String providerTag, String code) {
        OAuthProvider provider = registry.find(providerTag)
                .orElseThrow(() -> new ApiException(ErrorCode.OAUTH_UNKNOWN_PROVIDER));

        if (code == null || code.isBlank()) {
            throw new ApiException(ErrorCode.OAUTH_CODE_MISSING);
        }

        String providerToken = provider.exchangeCode(code);                 // no transaction open
        ExternalIdentity identity = provider.fetchProfile(providerToken);

        try {
            return federatedAccountService.loginOrRegister(provider.name(), identity);
        } catch (ConcurrentRegistrationException e) {
            log.info("Federated account insert collided, retrying. provider={}", provider.name());
            // second collision is not caught: it would mean a unique key that no lookup can see
            return federatedAccountService.loginOrRegister(provider.name(), identity);
        }
    }
}
