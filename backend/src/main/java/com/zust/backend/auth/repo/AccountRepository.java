package com.zust.backend.auth.repo;

import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.zust.backend.auth.domain.Account;

@Repository
public interface AccountRepository extends JpaRepository<Account, UUID> {

    Optional<Account> findByUsername(String username);

    Optional<Account> findByEmail(String email);

    boolean existsByEmail(String email);

    boolean existsByUsername(String username);

    boolean existsByOauthProviderAndOauthProviderId(String oauthProvider, String oauthProviderId);

    Optional<Account> findByOauthProviderAndOauthProviderId(String oauthProvider, String oauthProviderId);

    @Query("select a.tokenVersion from Account a where a.id = :id")
    Optional<Integer> findTokenVersionById(@Param("id") UUID id);

    /**
     * Single-statement increment: concurrent callers never lose an update.
     * @return affected rows (0 when the account does not exist)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Account a set a.tokenVersion = a.tokenVersion + 1 where a.id = :id")
    int incrementTokenVersion(@Param("id") UUID id);

    /**
     * Compare-and-increment: only moves the version forward if it still equals {@code expected}.
     * @return 1 on success, 0 when the version already moved or the account is gone
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Account a set a.tokenVersion = a.tokenVersion + 1 where a.id = :id and a.tokenVersion = :expected")
    int incrementTokenVersionIfCurrent(@Param("id") UUID id, @Param("expected") int expected);
}
