package com.zust.backend.security;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Duration;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

import com.zust.backend.auth.AbstractAuthIntegrationTest;
import com.zust.backend.auth.domain.Account;
import com.zust.backend.auth.domain.AccountRole;
import com.zust.backend.auth.support.AuthFlowSupport;
import com.zust.backend.auth.support.AuthHttpSupport;
import com.zust.backend.auth.support.AuthHttpSupport.LoginResult;
import com.zust.backend.global.ErrorCode;
import com.zust.backend.infra.TestClockConfig;
import com.zust.backend.security.token.TokenCodec;
import com.zust.backend.security.token.TokenKind;

/**
 * JwtAuthenticationFilter and the AUTH_REQUIRED entry point on a protected endpoint (GET /auth/me).
 *
 * Each token rejection reason maps to its own code, written by the filter before
 * any controller runs.
 */
@DisplayName("[Security] bearer authentication")
class BearerAuthenticationIntegrationTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;
    @Autowired TokenCodec tokenCodec;

    private Account account;

    @BeforeEach
    void seedUser() {
        account = createDefaultActiveUser();
    }

    @Test
    @DisplayName("non-Bearer scheme counts as no token → 401 AUTH_REQUIRED")
    void basic_scheme_is_ignored() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                mvc.perform(get(AuthHttpSupport.ME_ENDPOINT).header(HttpHeaders.AUTHORIZATION, "Basic dXNlcjpwdw==")),
                ErrorCode.AUTH_REQUIRED);
    }

    @Test
    @DisplayName("garbage token → 400 TOKEN_MALFORMED")
    void malformed() throws Exception {
        AuthHttpSupport.expectErrorWithCode(AuthHttpSupport.performMe(mvc, "not.a.jwt"), ErrorCode.TOKEN_MALFORMED);
    }

    @Test
    @DisplayName("signature does not verify → 400 TOKEN_SIGNATURE_INVALID")
    void bad_signature() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, USERNAME, PASSWORD);
        String token = login.accessToken();
        String tampered = token.substring(0, token.lastIndexOf('.') + 1) + "AAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA";

        AuthHttpSupport.expectErrorWithCode(AuthHttpSupport.performMe(mvc, tampered),
                ErrorCode.TOKEN_SIGNATURE_INVALID);
    }

    @Test
    @DisplayName("expired access token → 401 TOKEN_EXPIRED")
    void expired() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, USERNAME, PASSWORD);

        TestClockConfig.TEST_CLOCK.advance(Duration.ofMinutes(15).plusSeconds(1));

        AuthHttpSupport.expectErrorWithCode(AuthHttpSupport.performMe(mvc, login.accessToken()),
                ErrorCode.TOKEN_EXPIRED);
    }

    @Test
    @DisplayName("version older than the stored one → 401 TOKEN_STALE")
    void stale_version() throws Exception {
        String old = tokenCodec.issue(account.getId(), AccountRole.USER, TokenKind.ACCESS, 0, Duration.ofMinutes(5));

        AuthHttpSupport.expectErrorWithCode(AuthHttpSupport.performMe(mvc, old), ErrorCode.TOKEN_STALE);
    }

    @Test
    @DisplayName("version ahead of the stored one is just as invalid → 401 TOKEN_STALE")
    void future_version() throws Exception {
        String forged = tokenCodec.issue(account.getId(), AccountRole.USER, TokenKind.ACCESS, 99, Duration.ofMinutes(5));

        AuthHttpSupport.expectErrorWithCode(AuthHttpSupport.performMe(mvc, forged), ErrorCode.TOKEN_STALE);
    }

    @Test
    @DisplayName("token for an account that never existed → 401 TOKEN_STALE")
    void unknown_subject() throws Exception {
        String token = tokenCodec.issue(UUID.randomUUID(), AccountRole.USER, TokenKind.ACCESS, 1, Duration.ofMinutes(5));

        AuthHttpSupport.expectErrorWithCode(AuthHttpSupport.performMe(mvc, token), ErrorCode.TOKEN_STALE);
    }

    @Test
    @DisplayName("refresh token on an access endpoint → 400 TOKEN_KIND_MISMATCH")
    void refresh_token_on_access_endpoint() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, USERNAME, PASSWORD);

        AuthHttpSupport.expectErrorWithCode(AuthHttpSupport.performMe(mvc, login.refreshToken()),
                ErrorCode.TOKEN_KIND_MISMATCH);
    }

    @Test
    @DisplayName("error responses are not cacheable")
    void errors_are_not_cached() throws Exception {
        AuthHttpSupport.performMe(mvc, "not.a.jwt")
                .andExpect(status().isBadRequest())
                .andExpect(header().string(HttpHeaders.CACHE_CONTROL, "no-store"));
    }

    @Test
    @DisplayName("unknown route behind authentication → 404 NOT_FOUND, not 500")
    void unknown_route() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, USERNAME, PASSWORD);

        AuthHttpSupport.expectErrorWithCode(
                mvc.perform(AuthHttpSupport.withBearer(get("/auth/nothing-here"), login.accessToken())),
                ErrorCode.NOT_FOUND);
    }
}
