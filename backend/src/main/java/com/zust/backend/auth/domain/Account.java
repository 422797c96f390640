package com.zust.backend.auth.domain;

import java.time.Instant;
import java.util.UUID;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * account table.
 *
 * An account carries either a password hash (password registration) or an external
 * identity (OAuth registration), never both.
 *
 * {@code tokenVersion} is the only revocation mechanism for bearer tokens. It is changed
 * exclusively through the atomic update queries in {@code AccountRepository}, never through
 * dirty checking, so the entity exposes no setter for it.
 */
@Entity
@Table(name = "account", uniqueConstraints = {
        @UniqueConstraint(name = Account.UQ_EMAIL, columnNames = "email"),
        @UniqueConstraint(name = Account.UQ_USERNAME, columnNames = "username"),
        @UniqueConstraint(name = Account.UQ_OAUTH_IDENTITY, columnNames = {"oauth_provider", "oauth_provider_id"})
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Account {

    public static final String UQ_EMAIL = "uq_account_email";
    public static final String UQ_USERNAME = "uq_account_username";
    public static final String UQ_OAUTH_IDENTITY = "uq_account_oauth_identity";

    public static final int EMAIL_MAX_LENGTH = 40;
    public static final int USERNAME_MAX_LENGTH = 20;
    public static final int DESCRIPTION_MAX_LENGTH = 100;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @JdbcTypeCode(SqlTypes.CHAR)
    @Column(name = "account_id", length = 36, nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, length = EMAIL_MAX_LENGTH)
    private String email;

    @Column(nullable = false, length = USERNAME_MAX_LENGTH)
    private String username;

    @Column(name = "password_hash", length = 60)
    private String passwordHash;

    @Column(length = DESCRIPTION_MAX_LENGTH)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AccountStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AccountRole role;

    @Column(name = "oauth_provider", length = 10)
    private String oauthProvider;

    @Column(name = "oauth_provider_id", length = 64)
    private String oauthProviderId;

    @Column(name = "token_version", nullable = false, insertable = false, updatable = false)
    private int tokenVersion;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /** Password registration: starts INACTIVE until the email link is followed. */
    public static Account withPassword(String email, String username, String passwordHash, Instant now) {
        Account a = base(email, username, now);
        a.passwordHash = passwordHash;
        a.status = AccountStatus.INACTIVE;
        return a;
    }

    /** OAuth registration: the provider already verified the email, so the account is ACTIVE at once. */
    public static Account withExternalIdentity(String email, String username,
                                               String provider, String providerId, Instant now) {
        Account a = base(email, username, now);
        a.oauthProvider = provider;
        a.oauthProviderId = providerId;
        a.status = AccountStatus.ACTIVE;
        return a;
    }

    private static Account base(String email, String username, Instant now) {
        Account a = new Account();
        a.email = email;
        a.username = username;
        a.role = AccountRole.USER;
        a.tokenVersion = 1; // column default, mirrored so a freshly saved entity can mint tokens
        a.createdAt = now;
        return a;
    }

    public void activate() {
        status = AccountStatus.ACTIVE;
    }

    public void lock() {
        status = AccountStatus.LOCKED;
    }

    /** Profile edit; null keeps the current value. */
    public void editProfile(String newUsername, String newDescription) {
        if (newUsername != null) username = newUsername;
        if (newDescription != null) description = newDescription;
    }

    public boolean isActive() {
        return status == AccountStatus.ACTIVE;
    }

    public boolean hasPassword() {
        return passwordHash != null && !passwordHash.isBlank();
    }

    public UUID getId() {return id;}
    public String getEmail() {return email;}
    public String getUsername() {return username;}
    public String getPasswordHash() {return passwordHash;}
    public String getDescription() {return description;}
    public AccountStatus getStatus() {return status;}
    public AccountRole getRole() {return role;}
    public String getOauthProvider() {return oauthProvider;}
    public String getOauthProviderId() {return oauthProviderId;}
    public int getTokenVersion() {return tokenVersion;}
    public Instant getCreatedAt() {return createdAt;}
}
