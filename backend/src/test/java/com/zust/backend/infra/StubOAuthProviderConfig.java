package com.zust.backend.infra;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

@TestConfiguration
public class StubOAuthProviderConfig {

    @Bean
    StubOAuthProvider stubOAuthProvider() {
        return new StubOAuthProvider();
    }
}
