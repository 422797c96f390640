package com.zust.backend.auth.domain;

public enum AccountRole {
    USER,
    ADMIN
}
