package com.zust.backend.account.repo;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.zust.backend.account.domain.Subscription;

@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, Subscription.Key> {

    long countBySubscribeToId(UUID subscribeToId);

    /** @return 1 when the pair existed, 0 otherwise */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Subscription s where s.subscriberId = :subscriberId and s.subscribeToId = :subscribeToId")
    int deletePair(@Param("subscriberId") UUID subscriberId, @Param("subscribeToId") UUID subscribeToId);
}
