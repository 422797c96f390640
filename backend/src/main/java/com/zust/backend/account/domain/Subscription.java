package com.zust.backend.account.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * subscription table: subscriber follows subscribeTo.
 *
 * - (subscriber_id, subscribe_to_id) is the primary key, a pair exists at most once
 * - both ids reference account and are removed with either account (ON DELETE CASCADE)
 * - nobody subscribes to themselves; checked in SubscriptionService, MySQL cannot CHECK it here
 */
@Getter
@Entity
@Table(name = "subscription")
@IdClass(Subscription.Key.class)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Subscription {

    @Id
    @JdbcTypeCode(SqlTypes.CHAR)
    @Column(name = "subscriber_id", length = 36, nullable = false, updatable = false)
    private UUID subscriberId;

    @Id
    @JdbcTypeCode(SqlTypes.CHAR)
    @Column(name = "subscribe_to_id", length = 36, nullable = false, updatable = false)
    private UUID subscribeToId;

    @Column(name = "subscribed_at", nullable = false, updatable = false)
    private Instant subscribedAt;

    public static Subscription of(UUID subscriberId, UUID subscribeToId, Instant now) {
        Subscription s = new Subscription();
        s.subscriberId = subscriberId;
        s.subscribeToId = subscribeToId;
        s.subscribedAt = now;
        return s;
    }

    /** Composite id, field names match the @Id fields above. */
    public static class Key implements Serializable {

        private UUID subscriberId;
        private UUID subscribeToId;

        protected Key() {}

        public Key(UUID subscriberId, UUID subscribeToId) {
            this.subscriberId = subscriberId;
            this.subscribeToId = subscribeToId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Key other = (Key) o;
            return Objects.equals(subscriberId, other.subscriberId)
                    && Objects.equals(subscribeToId, other.subscribeToId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(subscriberId, subscribeToId);
        }
    }
}
