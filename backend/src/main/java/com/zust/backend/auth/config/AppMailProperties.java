package com.zust.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * app:
 *   mail:
 *     from: ${APP_MAIL_FROM:no-reply@zust.local}
 *     verification-subject: Zust - Verify your email
 */
@Validated
@ConfigurationProperties(prefix = "app.mail")
public record AppMailProperties(
        @NotBlank @Email String from,
        @NotBlank String verificationSubject) {
}
