package com.zust.backend.global;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.zust.backend.auth.federation.OAuthProviderException;
import com.zust.backend.security.session.SessionAuthority;
import com.zust.backend.security.token.TokenException;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns exceptions raised behind the controllers into {@link ApiError} responses.
 * Status codes come only from {@link ErrorCode}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiError> handleApiException(ApiException e) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(e.getStatus());

        if (e.getRetryAfterSeconds() != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()));
        }

        return builder.body(ApiError.from(e));
    }

    // Token rejected after the filter, e.g. a refresh token that lost the rotation race
    @ExceptionHandler(TokenException.class)
    public ResponseEntity<ApiError> handleTokenException(TokenException e) {
        log.debug("Token rejected in handler: reason={}, detail={}", e.getReason(), e.getMessage());
        ErrorCode code = e.getReason().errorCode();
        return ResponseEntity.status(code.status()).body(ApiError.of(code));
    }

    /**
     * Upstream identity provider failures are always server errors for the client.
     * The upstream body is only logged.
     */
    @ExceptionHandler(OAuthProviderException.class)
    public ResponseEntity<ApiError> handleOAuthProvider(OAuthProviderException e) {
        log.error("OAuth provider call failed: provider={}, stage={}, upstreamStatus={}, upstreamBody={}",
                e.getProvider(), e.getStage(), e.getUpstreamStatus(), e.getUpstreamBody(), e);

        ErrorCode code = e.getStage() == OAuthProviderException.Stage.EXCHANGE
                ? ErrorCode.OAUTH_EXCHANGE_FAILED
                : ErrorCode.OAUTH_FETCH_FAILED;

        return ResponseEntity.status(code.status()).body(ApiError.of(code));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {

        e.getBindingResult().getFieldErrors()
                .forEach(fe -> log.warn("Request validation failed: field={}, message={}", fe.getField(), fe.getDefaultMessage()));

        return ResponseEntity
                .status(ErrorCode.VALIDATION_ERROR.status())
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(ConstraintViolationException e) {

        e.getConstraintViolations()
                .forEach(v -> log.warn("Request validation failed: path={}, message={}", v.getPropertyPath(), v.getMessage()));

        return ResponseEntity
                .status(ErrorCode.VALIDATION_ERROR.status())
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }

    // Body missing or not JSON
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleNotReadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity
                .status(ErrorCode.VALIDATION_ERROR.status())
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing request parameter: {}", e.getParameterName());
        return ResponseEntity
                .status(ErrorCode.VALIDATION_ERROR.status())
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR, "Missing " + e.getParameterName()));
    }

    // e.g. a path id that is not a UUID
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Request parameter type mismatch: name={}, value={}", e.getName(), e.getValue());
        return ResponseEntity
                .status(ErrorCode.VALIDATION_ERROR.status())
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR, "Invalid " + e.getName()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiError> handleNoResource(NoResourceFoundException e) {
        return ResponseEntity
                .status(ErrorCode.NOT_FOUND.status())
                .body(ApiError.of(ErrorCode.NOT_FOUND));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiError> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        return ResponseEntity
                .status(ErrorCode.METHOD_NOT_ALLOWED.status())
                .body(ApiError.of(ErrorCode.METHOD_NOT_ALLOWED));
    }

    /**
     * Database unreachable outside the version store (login, register, lock, ...).
     * Accounts and token versions live in the same store, so the answer is the same retryable 503.
     */
    @ExceptionHandler({CannotCreateTransactionException.class, DataAccessResourceFailureException.class})
    public ResponseEntity<ApiError> handleStoreUnavailable(RuntimeException e) {
        log.error("Account store unavailable", e);
        return handleApiException(new ApiException(
                ErrorCode.SESSION_STORE_UNAVAILABLE, SessionAuthority.STORE_RETRY_AFTER_SECONDS));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnhandled(Exception e) {
        log.error("Unhandled exception", e);
        return ResponseEntity
                .status(ErrorCode.INTERNAL_ERROR.status())
                .body(ApiError.of(ErrorCode.INTERNAL_ERROR));
    }
}
