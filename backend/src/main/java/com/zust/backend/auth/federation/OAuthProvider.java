package com.zust.backend.auth.federation;

/**
 * One external identity provider in the authorization-code flow.
 * Implementations talk HTTP only; account reconciliation is not their concern.
 */
public interface OAuthProvider {

    /** Tag used in the callback {@code state} parameter and stored as account.oauth_provider. */
    String name();

    /**
     * Exchanges an authorization code for a provider access token.
     * @throws OAuthProviderException stage EXCHANGE
     */
    String exchangeCode(String code);

    /**
     * Loads the profile behind a provider access token.
     * @throws OAuthProviderException stage FETCH
     */
    ExternalIdentity fetchProfile(String accessToken);
}
