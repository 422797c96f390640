package com.zust.backend.security.token;

/**
 * Kind of a bearer token, carried in the {@code token_type} claim.
 */
public enum TokenKind {
    ACCESS("access-token"),
    REFRESH("refresh-token");

    private final String claimValue;

    TokenKind(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    /**
     * @throws IllegalArgumentException (InvalidKind) for anything but the two known values
     */
    public static TokenKind fromClaimValue(String raw) {
        if (raw != null) {
            String trimmed = raw.trim();
            for (TokenKind kind : values()) {
                if (kind.claimValue.equals(trimmed)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("InvalidKind: only access-token or refresh-token are accepted, got " + raw);
    }
}
