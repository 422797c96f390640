package com.zust.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/*
  app:
    auth:
      jwt:
        issuer: Zust
        secret: ${APP_AUTH_JWT_SECRET:?set APP_AUTH_JWT_SECRET}
        access-ttl-seconds: 900
        refresh-ttl-seconds: 604800
        clock-skew-seconds: 30

      verification:
        link-base-url: http://localhost:8080
        ttl-seconds: 86400
        hmac-secret: ${APP_AUTH_VERIFICATION_SECRET:?set APP_AUTH_VERIFICATION_SECRET}
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(@Valid @NotNull Jwt jwt,
                             @Valid @NotNull Verification verification) {

    /**
     * Bearer token settings.
     * - issuer: value of the {@code iss} claim, required on parse
     * - secret: HS256 key material, at least 32 bytes
     * - accessTtlSeconds / refreshTtlSeconds: lifetime of each token kind
     * - clockSkewSeconds: leeway applied to exp/iat checks
     */
    public record Jwt(
            @NotBlank String issuer,
            @NotBlank @Size(min = 32) String secret,
            @Min(1) long accessTtlSeconds,
            @Min(1) long refreshTtlSeconds,
            @Min(0) long clockSkewSeconds
    ) {}

    /**
     * Email verification link settings.
     * - linkBaseUrl: scheme + host (+ port) the mailed link points at
     * - ttlSeconds: how long a link stays usable
     * - hmacSecret: key signing the link token
     */
    public record Verification(
            @NotBlank @Pattern(regexp = "^https?://.*", message = "linkBaseUrl must be an http(s) URL")
            String linkBaseUrl,

            @Min(1) long ttlSeconds,

            @NotBlank @Size(min = 32) String hmacSecret
    ) {}
}
