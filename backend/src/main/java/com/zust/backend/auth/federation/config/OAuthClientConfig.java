package com.zust.backend.auth.federation.config;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import com.zust.backend.auth.config.OAuthProperties;
import com.zust.backend.auth.federation.provider.GitHubOAuthProvider;
import com.zust.backend.auth.federation.provider.GoogleOAuthProvider;

/**
 * Provider beans. Every {@code OAuthProvider} bean ends up in {@code OAuthProviderRegistry}.
 */
@Configuration
public class OAuthClientConfig {

    static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
    static final Duration READ_TIMEOUT = Duration.ofSeconds(10);

    @Bean
    RestClient oauthRestClient(RestClient.Builder builder) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) CONNECT_TIMEOUT.toMillis());
        requestFactory.setReadTimeout((int) READ_TIMEOUT.toMillis());

        return builder.requestFactory(requestFactory).build();
    }

    @Bean
    GitHubOAuthProvider gitHubOAuthProvider(RestClient oauthRestClient, OAuthProperties props) {
        return new GitHubOAuthProvider(oauthRestClient, props.github());
    }

    @Bean
    GoogleOAuthProvider googleOAuthProvider(RestClient oauthRestClient, OAuthProperties props) {
        return new GoogleOAuthProvider(oauthRestClient, props.google());
    }
}
