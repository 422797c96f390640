package com.zust.backend.auth.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MockMvc;

import com.zust.backend.auth.AbstractAuthIntegrationTest;
import com.zust.backend.auth.domain.Account;
import com.zust.backend.auth.support.AuthFlowSupport;
import com.zust.backend.auth.support.AuthHttpSupport;
import com.zust.backend.auth.support.AuthHttpSupport.LoginResult;
import com.zust.backend.auth.support.AuthHttpSupport.RefreshResult;
import com.zust.backend.global.ErrorCode;
import com.zust.backend.infra.TestClockConfig;
import com.zust.backend.security.token.TokenCodec;

/**
 * POST /auth/token/refresh with {@code Authorization: Bearer <refresh token>}
 *
 * Rotation: a successful refresh moves token_version forward, so the old pair
 * (and the refresh token just used) stop working.
 */
@DisplayName("[Auth][Token] refresh rotation")
class AuthRefreshIntegrationTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;
    @Autowired TokenCodec tokenCodec;

    private Account account;
    private LoginResult login;

    @BeforeEach
    void login() throws Exception {
        account = createDefaultActiveUser();
        login = AuthFlowSupport.loginOk(mvc, USERNAME, PASSWORD);
    }

    @Test
    @DisplayName("refresh → new pair at version + 1, new access token works")
    void refresh_ok() throws Exception {
        RefreshResult refreshed = AuthFlowSupport.refreshOk(mvc, login.refreshToken());

        assertThat(tokenCodec.parse(refreshed.accessToken()).version()).isEqualTo(2);
        assertThat(tokenCodec.parse(refreshed.refreshToken()).version()).isEqualTo(2);
        assertThat(reload(account).getTokenVersion()).isEqualTo(2);

        AuthHttpSupport.performMe(mvc, refreshed.accessToken())
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("old access token is stale after a refresh")
    void old_access_token_is_stale() throws Exception {
        AuthFlowSupport.refreshOk(mvc, login.refreshToken());

        AuthHttpSupport.expectErrorWithCode(AuthHttpSupport.performMe(mvc, login.accessToken()),
                ErrorCode.TOKEN_STALE);
    }

    @Test
    @DisplayName("the same refresh token works only once")
    void refresh_token_is_single_use() throws Exception {
        AuthFlowSupport.refreshOk(mvc, login.refreshToken());

        AuthHttpSupport.expectErrorWithCode(AuthHttpSupport.performRefresh(mvc, login.refreshToken()),
                ErrorCode.TOKEN_STALE);
    }

    @Test
    @DisplayName("rotated refresh token can be used for the next refresh")
    void chained_refresh() throws Exception {
        RefreshResult first = AuthFlowSupport.refreshOk(mvc, login.refreshToken());
        RefreshResult second = AuthFlowSupport.refreshOk(mvc, first.refreshToken());

        assertThat(tokenCodec.parse(second.accessToken()).version()).isEqualTo(3);
    }

    @Test
    @DisplayName("access token on the refresh endpoint → 400 TOKEN_KIND_MISMATCH")
    void access_token_rejected() throws Exception {
        AuthHttpSupport.expectErrorWithCode(AuthHttpSupport.performRefresh(mvc, login.accessToken()),
                ErrorCode.TOKEN_KIND_MISMATCH);

        assertThat(reload(account).getTokenVersion()).isEqualTo(1);
    }

    @Test
    @DisplayName("no bearer token → 401 AUTH_REQUIRED")
    void missing_token() throws Exception {
        AuthHttpSupport.expectErrorWithCode(AuthHttpSupport.performRefresh(mvc, null),
                ErrorCode.AUTH_REQUIRED);
    }

    @Test
    @DisplayName("expired refresh token → 401 TOKEN_EXPIRED")
    void expired_refresh_token() throws Exception {
        TestClockConfig.TEST_CLOCK.advance(Duration.ofDays(7).plusSeconds(1));

        AuthHttpSupport.expectErrorWithCode(AuthHttpSupport.performRefresh(mvc, login.refreshToken()),
                ErrorCode.TOKEN_EXPIRED);
    }
}
