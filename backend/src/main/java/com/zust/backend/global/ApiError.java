package com.zust.backend.global;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body shared by the controller advice and the security filter chain.
 *
 * <ul>
 *   <li>code: stable identifier for client branching ({@link ErrorCode#name()})</li>
 *   <li>message: human readable text, may change</li>
 *   <li>retryAfterSeconds: set for retryable server-side failures</li>
 *   <li>details: optional extra payload</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String code,
        String message,
        Integer retryAfterSeconds,
        Object details
) {
    public static ApiError of(ErrorCode errorCode) {
        return new ApiError(errorCode.name(), errorCode.defaultMessage(), null, null);
    }

    public static ApiError of(ErrorCode errorCode, String messageOverride) {
        return new ApiError(errorCode.name(), messageOverride, null, null);
    }

    public static ApiError from(ApiException e) {
        return new ApiError(e.getCode(), e.getMessage(), e.getRetryAfterSeconds(), e.getDetails());
    }
}
