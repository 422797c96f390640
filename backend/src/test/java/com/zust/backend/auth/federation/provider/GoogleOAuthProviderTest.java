package com.zust.backend.auth.federation.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import com.zust.backend.auth.config.OAuthProperties;
import com.zust.backend.auth.federation.ExternalIdentity;
import com.zust.backend.auth.federation.OAuthProviderException;
import com.zust.backend.auth.federation.OAuthProviderException.Stage;

@DisplayName("[Auth][Federation] GoogleOAuthProvider")
class GoogleOAuthProviderTest {

    private static final String TOKEN_URI = "https://oauth2.google.test/token";
    private static final String USER_URI = "https://www.google.test/oauth2/v2/userinfo";
    private static final String REDIRECT_URI = "http://localhost:8080/oauth2/callback";

    private MockRestServiceServer server;
    private GoogleOAuthProvider provider;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        provider = new GoogleOAuthProvider(builder.build(),
                new OAuthProperties.Google("g-client", "g-secret", TOKEN_URI, USER_URI, REDIRECT_URI));
    }

    @Test
    @DisplayName("exchange: authorization_code grant with redirect_uri")
    void exchange_ok() {
        server.expect(requestTo(TOKEN_URI))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().formDataContains(Map.of(
                        "grant_type", "authorization_code",
                        "redirect_uri", REDIRECT_URI,
                        "code", "4/0Ab")))
                .andRespond(withSuccess("{\"access_token\":\"ya29.token\",\"expires_in\":3599}",
                        MediaType.APPLICATION_JSON));

        assertThat(provider.exchangeCode("4/0Ab")).isEqualTo("ya29.token");
        server.verify();
    }

    @Test
    @DisplayName("exchange: invalid_grant (400) → EXCHANGE failure")
    void exchange_invalid_grant() {
        server.expect(requestTo(TOKEN_URI))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"invalid_grant\"}"));

        assertThatThrownBy(() -> provider.exchangeCode("used"))
                .isInstanceOfSatisfying(OAuthProviderException.class, e -> {
                    assertThat(e.getStage()).isEqualTo(Stage.EXCHANGE);
                    assertThat(e.getUpstreamStatus()).isEqualTo(400);
                    assertThat(e.getUpstreamBody()).contains("invalid_grant");
                });
    }

    @Test
    @DisplayName("fetch: userinfo → identity")
    void fetch_ok() {
        server.expect(requestTo(USER_URI))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer ya29.token"))
                .andRespond(withSuccess("""
                        {"id":"1098","name":"Jane Doe","picture":"https://lh3.google.test/a","email":"jane@gmail.test","verified_email":true}
                        """, MediaType.APPLICATION_JSON));

        assertThat(provider.fetchProfile("ya29.token"))
                .isEqualTo(new ExternalIdentity("1098", "Jane Doe", "https://lh3.google.test/a", "jane@gmail.test"));
    }

    @Test
    @DisplayName("fetch: email scope missing → FETCH failure")
    void fetch_without_email() {
        server.expect(requestTo(USER_URI))
                .andRespond(withSuccess("{\"id\":\"1098\",\"name\":\"Jane Doe\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider.fetchProfile("ya29.token"))
                .isInstanceOfSatisfying(OAuthProviderException.class,
                        e -> assertThat(e.getStage()).isEqualTo(Stage.FETCH));
    }
}
