package com.zust.backend.security.token;

import com.zust.backend.global.ErrorCode;

import lombok.Getter;

/**
 * Bearer token rejected. The {@link Reason} decides the HTTP outcome.
 */
@Getter
public class TokenException extends RuntimeException {

    public enum Reason {
        EXPIRED(ErrorCode.TOKEN_EXPIRED),
        MALFORMED(ErrorCode.TOKEN_MALFORMED),
        BAD_SIGNATURE(ErrorCode.TOKEN_SIGNATURE_INVALID),
        INVALID_CLAIMS(ErrorCode.TOKEN_CLAIMS_INVALID),
        STALE_VERSION(ErrorCode.TOKEN_STALE),
        WRONG_KIND(ErrorCode.TOKEN_KIND_MISMATCH);

        private final ErrorCode errorCode;

        Reason(ErrorCode errorCode) {
            this.errorCode = errorCode;
        }

        public ErrorCode errorCode() {
            return errorCode;
        }
    }

    private final Reason reason;

    public TokenException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TokenException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
