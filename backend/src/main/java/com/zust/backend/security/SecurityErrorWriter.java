package com.zust.backend.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zust.backend.global.ApiError;
import com.zust.backend.global.ApiException;
import com.zust.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * Writes {@link ApiError} bodies from the filter chain, where {@code GlobalExceptionHandler}
 * is not reached.
 */
@Component
@RequiredArgsConstructor
public class SecurityErrorWriter {

    private final ObjectMapper objectMapper;

    public void write(HttpServletResponse response, ErrorCode errorCode) throws IOException {
        write(response, errorCode, errorCode.defaultMessage());
    }

    public void write(HttpServletResponse response, ErrorCode errorCode, String messageOverride) throws IOException {
        if (response.isCommitted())
            return;

        prepare(response, errorCode.status().value());
        objectMapper.writeValue(response.getWriter(), ApiError.of(errorCode, messageOverride));
    }

    public void write(HttpServletResponse response, ApiException e) throws IOException {
        if (response.isCommitted())
            return;

        prepare(response, e.getStatus().value());
        if (e.getRetryAfterSeconds() != null) {
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()));
        }
        objectMapper.writeValue(response.getWriter(), ApiError.from(e));
    }

    private static void prepare(HttpServletResponse response, int status) {
        response.setHeader(HttpHeaders.CACHE_CONTROL, "no-store");
        response.setHeader(HttpHeaders.PRAGMA, "no-cache");

        response.setStatus(status);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType("application/json;charset=UTF-8");
    }
}
