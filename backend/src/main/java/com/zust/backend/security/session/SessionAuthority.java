package com.zust.backend.security.session;

import java.time.Duration;
import java.util.UUID;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import com.zust.backend.auth.config.AuthProperties;
import com.zust.backend.auth.domain.Account;
import com.zust.backend.auth.domain.AccountRole;
import com.zust.backend.global.ApiException;
import com.zust.backend.global.ErrorCode;
import com.zust.backend.security.AuthPrincipal;
import com.zust.backend.security.token.TokenClaims;
import com.zust.backend.security.token.TokenCodec;
import com.zust.backend.security.token.TokenException;
import com.zust.backend.security.token.TokenKind;

import lombok.extern.slf4j.Slf4j;

/**
 * Bearer token lifecycle: issue, verify, invalidate, refresh.
 *
 * - No server-side session. A token is valid while its signature checks out, it has not
 *   expired and its embedded version equals the stored token_version of its account.
 * - Moving token_version forward kills every outstanding token of the account at once,
 *   on every device. There is no revocation list.
 * - HTTP is not known here. Failures are TokenException (reason per rejection) or
 *   ApiException; the filter and GlobalExceptionHandler render them.
 *
 * Callers:
 * - issue: password login (LoginService), OAuth login/registration (FederatedAccountService)
 * - verify: every request carrying a bearer token (JwtAuthenticationFilter)
 * - invalidate: logout, account lock
 * - refresh: POST /auth/token/refresh
 *
 * Version store:
 * - No transaction is opened here. TokenVersionStore owns it, so a database that cannot
 *   even open one fails inside the try blocks below.
 * - Both failure families (DataAccessException, TransactionException) become
 *   503 SESSION_STORE_UNAVAILABLE with Retry-After, never a token error. The same token
 *   is accepted again once the store is back.
 */
@Slf4j
@Service
public class SessionAuthority {

    public static final int STORE_RETRY_AFTER_SECONDS = 1;

    private final TokenCodec tokenCodec;
    private final TokenVersionStore versionStore;
    private final Duration accessTtl;
    private final Duration refreshTtl;

    public SessionAuthority(TokenCodec tokenCodec, TokenVersionStore versionStore, AuthProperties props) {
        this.tokenCodec = tokenCodec;
        this.versionStore = versionStore;
        this.accessTtl = Duration.ofSeconds(props.jwt().accessTtlSeconds());
        this.refreshTtl = Duration.ofSeconds(props.jwt().refreshTtlSeconds());
    }

    /**
     * Access + refresh token at the account's current version.
     * The account must be ACTIVE, otherwise 403 ACCOUNT_NOT_ACTIVE.
     */
    public IssuedTokens issue(Account account) {
        if (account == null) throw new IllegalArgumentException("account must not be null");
        if (!account.isActive()) {
            throw new ApiException(ErrorCode.ACCOUNT_NOT_ACTIVE);
        }
        return mint(account.getId(), account.getRole(), account.getTokenVersion());
    }

    /**
     * Full check of a presented token.
     *
     * Order: codec (signature, alg, issuer, expiry, claims) → version lookup → kind.
     * The kind check comes last so that a stale refresh token sent to a normal endpoint
     * is reported as stale, which is what the client needs to act on (log in again).
     *
     * An unknown subject (deleted account) has no stored version and is STALE_VERSION.
     *
     * @param requiredKind the kind the target endpoint accepts (see {@link EndpointTokenPolicy})
     * @throws TokenException codec failures, STALE_VERSION or WRONG_KIND
     * @throws ApiException SESSION_STORE_UNAVAILABLE when the version lookup fails
     */
    public AuthPrincipal verify(String token, TokenKind requiredKind) {
        TokenClaims claims = tokenCodec.parse(token);

        Integer current = loadVersion(claims.subject());
        if (current == null || current != claims.version()) {
            throw new TokenException(TokenException.Reason.STALE_VERSION,
                    "token version " + claims.version() + " is not current for account " + claims.subject());
        }

        if (claims.kind() != requiredKind) {
            throw new TokenException(TokenException.Reason.WRONG_KIND,
                    claims.kind().claimValue() + " is not accepted here, expected " + requiredKind.claimValue());
        }

        return new AuthPrincipal(claims.subject(), claims.role(), claims.kind(), claims.version());
    }

    /**
     * Moves the account's token_version forward, killing all of its tokens.
     *
     * Joins the caller's transaction if there is one (account lock changes status and version
     * together), otherwise the increment commits on its own.
     *
     * @throws ApiException ACCOUNT_NOT_FOUND if no such account, SESSION_STORE_UNAVAILABLE on store failure
     */
    public void invalidate(UUID accountId) {
        boolean moved;
        try {
            moved = versionStore.increment(accountId);
        } catch (DataAccessException | TransactionException e) {
            throw storeUnavailable("increment", accountId, e);
        }

        if (!moved) {
            throw new ApiException(ErrorCode.ACCOUNT_NOT_FOUND);
        }
        log.info("Token version incremented. accountId={}", accountId);
    }

    /**
     * Burns the presented refresh token's version and mints a new pair at version + 1.
     *
     * The increment only succeeds if the stored version still equals the token's version
     * (compare-and-set in one UPDATE), so two concurrent refreshes with the same token cannot
     * both succeed: the loser sees STALE_VERSION.
     *
     * Side effect: the access tokens of the account, on every device, die with it.
     */
    public IssuedTokens refresh(AuthPrincipal principal) {
        if (principal.kind() != TokenKind.REFRESH) {
            throw new TokenException(TokenException.Reason.WRONG_KIND, "refresh requires a refresh token");
        }

        boolean moved;
        try {
            moved = versionStore.incrementIfCurrent(principal.accountId(), principal.version());
        } catch (DataAccessException | TransactionException e) {
            throw storeUnavailable("increment", principal.accountId(), e);
        }

        if (!moved) {
            throw new TokenException(TokenException.Reason.STALE_VERSION, "refresh token already used");
        }
        return mint(principal.accountId(), principal.role(), principal.version() + 1);
    }

    private Integer loadVersion(UUID accountId) {
        try {
            return versionStore.current(accountId).orElse(null);
        } catch (DataAccessException | TransactionException e) {
            throw storeUnavailable("lookup", accountId, e);
        }
    }

    private IssuedTokens mint(UUID accountId, AccountRole role, int version) {
        String access = tokenCodec.issue(accountId, role, TokenKind.ACCESS, version, accessTtl);
        String refresh = tokenCodec.issue(accountId, role, TokenKind.REFRESH, version, refreshTtl);
        return new IssuedTokens(access, refresh, version);
    }

    private static ApiException storeUnavailable(String operation, UUID accountId, RuntimeException e) {
        log.error("Token version {} failed. accountId={}", operation, accountId, e);
        return new ApiException(ErrorCode.SESSION_STORE_UNAVAILABLE, STORE_RETRY_AFTER_SECONDS);
    }
}
