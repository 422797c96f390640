package com.zust.backend.media.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/*
  app:
    media:
      resource-path: ${APP_MEDIA_RESOURCE_PATH:./storage}
      public-base-url: ${APP_MEDIA_PUBLIC_BASE_URL:http://localhost:8080}
      avatar-download-attempts: 3
      avatar-max-size: 5MB
 */
@Validated
@ConfigurationProperties(prefix = "app.media")
public record MediaProperties(
        @NotBlank String resourcePath,
        @NotBlank String publicBaseUrl,
        @Min(1) @Max(10) int avatarDownloadAttempts,
        @NotNull DataSize avatarMaxSize) {
}
