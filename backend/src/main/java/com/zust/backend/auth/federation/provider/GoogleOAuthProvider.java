package com.zust.backend.auth.federation.provider;

import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.zust.backend.auth.config.OAuthProperties;
import com.zust.backend.auth.federation.ExternalIdentity;
import com.zust.backend.auth.federation.OAuthProviderException.Stage;

/**
 * Google OAuth 2.0 web client, profile from the v2 userinfo endpoint.
 */
public class GoogleOAuthProvider extends RestClientOAuthProvider {

    public static final String NAME = "google";

    private final OAuthProperties.Google props;

    public GoogleOAuthProvider(RestClient restClient, OAuthProperties.Google props) {
        super(restClient);
        this.props = props;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String exchangeCode(String code) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("client_id", props.clientId());
        form.add("client_secret", props.clientSecret());
        form.add("code", code);
        form.add("grant_type", "authorization_code");
        form.add("redirect_uri", props.redirectUri());

        TokenResponse res = postForm(props.tokenUri(), form, TokenResponse.class);
        if (res == null || isBlank(res.accessToken())) {
            throw invalidAnswer(Stage.EXCHANGE, "google returned no access_token");
        }
        return res.accessToken();
    }

    @Override
    public ExternalIdentity fetchProfile(String accessToken) {
        GoogleUser user = getWithBearer(props.userUri(), accessToken, MediaType.APPLICATION_JSON, GoogleUser.class);
        if (user == null || isBlank(user.id())) {
            throw invalidAnswer(Stage.FETCH, "google user has no id");
        }
        if (isBlank(user.email())) {
            throw invalidAnswer(Stage.FETCH, "google user has no email, is the email scope granted?");
        }
        return new ExternalIdentity(user.id(), user.name(), user.picture(), user.email());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenResponse(@JsonProperty("access_token") String accessToken) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GoogleUser(String id, String name, String picture, String email) {}
}
