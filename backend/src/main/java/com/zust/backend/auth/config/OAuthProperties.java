package com.zust.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/*
  app:
    oauth:
      github:
        client-id: ${GITHUB_CLIENT_ID:}
        client-secret: ${GITHUB_CLIENT_SECRET:}
        token-uri: https://github.com/login/oauth/access_token
        user-uri: https://api.github.com/user
        emails-uri: https://api.github.com/user/emails
      google:
        client-id: ${GOOGLE_CLIENT_ID:}
        client-secret: ${GOOGLE_CLIENT_SECRET:}
        token-uri: https://oauth2.googleapis.com/token
        user-uri: https://www.googleapis.com/oauth2/v2/userinfo
        redirect-uri: http://localhost:8080/oauth2/callback
 */
@Validated
@ConfigurationProperties(prefix = "app.oauth")
public record OAuthProperties(@Valid @NotNull GitHub github,
                              @Valid @NotNull Google google) {

    public record GitHub(
            String clientId,
            String clientSecret,
            @NotBlank String tokenUri,
            @NotBlank String userUri,
            @NotBlank String emailsUri
    ) {}

    public record Google(
            String clientId,
            String clientSecret,
            @NotBlank String tokenUri,
            @NotBlank String userUri,
            @NotBlank String redirectUri
    ) {}
}
