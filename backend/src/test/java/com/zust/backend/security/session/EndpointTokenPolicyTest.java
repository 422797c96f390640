package com.zust.backend.security.session;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import com.zust.backend.security.token.TokenKind;

@DisplayName("[Security][Session] EndpointTokenPolicy")
class EndpointTokenPolicyTest {

    @Test
    @DisplayName("refresh endpoint wants a refresh token, every other path an access token")
    void kind_by_path() {
        assertThat(EndpointTokenPolicy.requiredKind("/auth/token/refresh")).isEqualTo(TokenKind.REFRESH);
        assertThat(EndpointTokenPolicy.requiredKind("/auth/me")).isEqualTo(TokenKind.ACCESS);
        assertThat(EndpointTokenPolicy.requiredKind("/auth/logout")).isEqualTo(TokenKind.ACCESS);
        assertThat(EndpointTokenPolicy.requiredKind("/auth/token/refresh/extra")).isEqualTo(TokenKind.ACCESS);
    }

    @Test
    @DisplayName("context path and trailing slash are ignored")
    void request_path_is_normalized() {
        MockHttpServletRequest withContext = new MockHttpServletRequest("POST", "/api/auth/token/refresh");
        withContext.setContextPath("/api");

        MockHttpServletRequest trailingSlash = new MockHttpServletRequest("POST", "/auth/token/refresh/");

        assertThat(EndpointTokenPolicy.requiredKind(withContext)).isEqualTo(TokenKind.REFRESH);
        assertThat(EndpointTokenPolicy.requiredKind(trailingSlash)).isEqualTo(TokenKind.REFRESH);
    }
}
