package com.zust.backend.global;

import org.springframework.http.HttpStatus;

/**
 * Single source of client-facing error code, HTTP status and default message.
 *
 * The enum name is the API contract ({@code $.code}); status and wording may change.
 */
public enum ErrorCode {

    // Request shape
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST,
            "Invalid request body"),

    // Password login
    INVALID_CREDENTIALS(HttpStatus.BAD_REQUEST,
            "Invalid username or password"),
    PASSWORD_NOT_SET(HttpStatus.BAD_REQUEST,
            "Account does not have a password, please login with OAuth provider"),
    ACCOUNT_NOT_ACTIVE(HttpStatus.FORBIDDEN,
            "Account is not active"),

    // Registration
    EMAIL_ALREADY_TAKEN(HttpStatus.BAD_REQUEST,
            "Email is already taken"),
    USERNAME_ALREADY_TAKEN(HttpStatus.BAD_REQUEST,
            "Username is already taken"),

    // Email verification
    VERIFICATION_TOKEN_MISSING(HttpStatus.BAD_REQUEST,
            "Missing token"),
    VERIFICATION_TOKEN_INVALID(HttpStatus.BAD_REQUEST,
            "Invalid token"),
    VERIFICATION_TOKEN_EXPIRED(HttpStatus.BAD_REQUEST,
            "Token has expired"),
    EMAIL_MISSING(HttpStatus.BAD_REQUEST,
            "Missing email"),
    EMAIL_NOT_REGISTERED(HttpStatus.BAD_REQUEST,
            "Account with this email does not exist"),
    ACCOUNT_STATUS_CONFLICT(HttpStatus.BAD_REQUEST,
            "Account status does not allow this operation"), // message carries the actual status

    // Accounts
    ACCOUNT_NOT_FOUND(HttpStatus.BAD_REQUEST,
            "Account does not exist"),
    ACCOUNT_ID_MISMATCH(HttpStatus.BAD_REQUEST,
            "Account ID not match with the ID from access token"),
    PROFILE_NOT_FOUND(HttpStatus.NOT_FOUND,
            "Account not found"),

    // Subscriptions
    SUBSCRIBE_SELF(HttpStatus.BAD_REQUEST,
            "Cannot subscribe to your own account"),
    ALREADY_SUBSCRIBED(HttpStatus.BAD_REQUEST,
            "Already subscribed to this account"),
    SUBSCRIPTION_TARGET_NOT_FOUND(HttpStatus.NOT_FOUND,
            "Account to subscribe to does not exist"),

    // OAuth2
    OAUTH_UNKNOWN_PROVIDER(HttpStatus.BAD_REQUEST,
            "Unknown provider"),
    OAUTH_CODE_MISSING(HttpStatus.BAD_REQUEST,
            "Missing authorization code"),
    OAUTH_EMAIL_TOO_LONG(HttpStatus.BAD_REQUEST,
            "Email from the provider is longer than 40 characters"),
    OAUTH_EXCHANGE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR,
            "Failed to exchange token"),
    OAUTH_FETCH_FAILED(HttpStatus.INTERNAL_SERVER_ERROR,
            "Failed to fetch user data"),

    // Bearer tokens
    AUTH_REQUIRED(HttpStatus.UNAUTHORIZED,
            "Missing request header"),
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED,
            "Access token expired"),
    TOKEN_STALE(HttpStatus.UNAUTHORIZED,
            "Invalid access token: token version is not valid"),
    TOKEN_MALFORMED(HttpStatus.BAD_REQUEST,
            "Invalid access token: token is malformed"),
    TOKEN_SIGNATURE_INVALID(HttpStatus.BAD_REQUEST,
            "Invalid access token: signature is invalid"),
    TOKEN_CLAIMS_INVALID(HttpStatus.BAD_REQUEST,
            "Invalid access token: token claims are invalid"),
    TOKEN_KIND_MISMATCH(HttpStatus.BAD_REQUEST,
            "Invalid access token: unsuitable token type for this request"),
    SESSION_STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE,
            "Session store is temporarily unavailable, please retry"),

    // Media
    MEDIA_NOT_FOUND(HttpStatus.NOT_FOUND,
            "Media not found"),

    // Routing
    NOT_FOUND(HttpStatus.NOT_FOUND,
            "Not found"),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED,
            "Method not allowed"),

    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR,
            "Internal server error");

    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
