package com.zust.backend.auth.federation.provider;

import java.util.List;
import java.util.Optional;

import org.springframework.core.ParameterizedTypeReference;
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
 * GitHub OAuth app.
 *
 * GitHub answers a bad code with 200 and an {@code error} field, so a missing access_token
 * is treated as an exchange failure. A private profile email is looked up on /user/emails.
 */
public class GitHubOAuthProvider extends RestClientOAuthProvider {

    public static final String NAME = "github";

    static final MediaType GITHUB_JSON = MediaType.parseMediaType("application/vnd.github+json");

    private final OAuthProperties.GitHub props;

    public GitHubOAuthProvider(RestClient restClient, OAuthProperties.GitHub props) {
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

        TokenResponse res = postForm(props.tokenUri(), form, TokenResponse.class);
        if (res == null || isBlank(res.accessToken())) {
            String error = res == null ? "empty body" : res.error() + ": " + res.errorDescription();
            throw invalidAnswer(Stage.EXCHANGE, "github returned no access_token (" + error + ")");
        }
        return res.accessToken();
    }

    @Override
    public ExternalIdentity fetchProfile(String accessToken) {
        GitHubUser user = getWithBearer(props.userUri(), accessToken, GITHUB_JSON, GitHubUser.class);
        if (user == null || user.id() == null) {
            throw invalidAnswer(Stage.FETCH, "github user has no id");
        }

        String email = isBlank(user.email())
                ? primaryVerifiedEmail(accessToken)
                        .orElseThrow(() -> invalidAnswer(Stage.FETCH, "github account has no verified email"))
                : user.email();

        return new ExternalIdentity(String.valueOf(user.id()), user.login(), user.avatarUrl(), email);
    }

    private Optional<String> primaryVerifiedEmail(String accessToken) {
        List<GitHubEmail> emails = getWithBearer(props.emailsUri(), accessToken, GITHUB_JSON,
                new ParameterizedTypeReference<List<GitHubEmail>>() {});
        if (emails == null) return Optional.empty();

        return emails.stream()
                .filter(e -> e.verified() && e.primary())
                .map(GitHubEmail::email)
                .findFirst()
                .or(() -> emails.stream()
                        .filter(GitHubEmail::verified)
                        .map(GitHubEmail::email)
                        .findFirst());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenResponse(
            @JsonProperty("access_token") String accessToken,
            @JsonProperty("error") String error,
            @JsonProperty("error_description") String errorDescription
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GitHubUser(
            Long id,
            String login,
            @JsonProperty("avatar_url") String avatarUrl,
            String email
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GitHubEmail(String email, boolean primary, boolean verified) {}
}
