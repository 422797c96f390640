package com.zust.backend.auth.config;

import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Shared beans of the auth module.
 *
 * The {@link Clock} is replaced by a mutable one in tests, which is why it backs off
 * when another Clock bean exists.
 */
@Configuration
@EnableConfigurationProperties({
        AuthProperties.class,
        OAuthProperties.class,
        AppMailProperties.class
})
public class AuthModuleConfig {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
