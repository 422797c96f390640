package com.zust.backend.auth.domain;

import java.util.Locale;

public enum AccountStatus {
    INACTIVE, // registered with a password, email not verified yet
    ACTIVE,
    BANNED,
    LOCKED;

    /** Lower-case form used in client messages ("Account is locked"). */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
