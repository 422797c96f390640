package com.zust.backend.global;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * Business rule violation expressed as an {@link ErrorCode}.
 *
 * <pre>
 * throw new ApiException(ErrorCode.ACCOUNT_NOT_ACTIVE);
 * </pre>
 *
 * {@link GlobalExceptionHandler} and {@code SecurityErrorWriter} turn it into an {@link ApiError}.
 */
@Getter
public class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;
    private final Integer retryAfterSeconds;
    private final Object details;

    public ApiException(ErrorCode errorCode) {
        this(errorCode, errorCode.defaultMessage(), null, null);
    }

    public ApiException(ErrorCode errorCode, String messageOverride) {
        this(errorCode, messageOverride, null, null);
    }

    public ApiException(ErrorCode errorCode, Integer retryAfterSeconds) {
        this(errorCode, errorCode.defaultMessage(), retryAfterSeconds, null);
    }

    public ApiException(ErrorCode errorCode, String messageOverride, Integer retryAfterSeconds, Object details) {
        super(resolveMessage(errorCode, messageOverride));

        if (errorCode == null)
            throw new IllegalArgumentException("ErrorCode must not be null");

        this.status = errorCode.status();
        this.code = errorCode.name();
        this.retryAfterSeconds = retryAfterSeconds;
        this.details = details;
    }

    private static String resolveMessage(ErrorCode errorCode, String messageOverride) {
        if (messageOverride != null && !messageOverride.isBlank()) {
            return messageOverride;
        }
        return (errorCode == null) ? null : errorCode.defaultMessage();
    }
}
