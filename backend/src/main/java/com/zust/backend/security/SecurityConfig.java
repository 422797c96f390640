package com.zust.backend.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import com.zust.backend.global.ErrorCode;
import com.zust.backend.security.session.SessionAuthority;

import lombok.RequiredArgsConstructor;

/**
 * Stateless filter chain: bearer JWT only, no session, no form or basic login.
 *
 * - missing token on a protected path: the entry point below writes 401 AUTH_REQUIRED
 * - token present but rejected: JwtAuthenticationFilter answers before the entry point is reached
 */
@Configuration
@RequiredArgsConstructor
public class SecurityConfig {

    private final SessionAuthority sessionAuthority;
    private final SecurityErrorWriter securityErrorWriter;

    @Bean
    JwtAuthenticationFilter jwtAuthenticationFilter() {
        return new JwtAuthenticationFilter(sessionAuthority, securityErrorWriter);
    }

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        return http
                .csrf(csrf -> csrf.disable())
                .httpBasic(b -> b.disable())
                .formLogin(f -> f.disable())
                .logout(l -> l.disable())
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(eh -> eh.authenticationEntryPoint(
                        (request, response, authException) ->
                                securityErrorWriter.write(response, ErrorCode.AUTH_REQUIRED)))
                .addFilterBefore(
                        jwtAuthenticationFilter(),
                        UsernamePasswordAuthenticationFilter.class
                )
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/error").permitAll()
                        .requestMatchers("/actuator/health/**").permitAll()

                        .requestMatchers(HttpMethod.POST, "/auth/login", "/auth/register").permitAll()
                        .requestMatchers(HttpMethod.GET, "/auth/verification").permitAll()
                        .requestMatchers(HttpMethod.POST, "/auth/verification/resend").permitAll()
                        .requestMatchers(HttpMethod.GET, "/oauth2/callback").permitAll()
                        .requestMatchers(HttpMethod.GET, "/media/**").permitAll()
                        .requestMatchers(HttpMethod.GET, "/accounts/*").permitAll()   // public profile

                        // /auth/token/refresh, /auth/logout, /auth/me, PUT /accounts/{id}, /accounts/{id}/lock, /subscribe
                        .anyRequest().authenticated()
                )
                .build();
    }
}
