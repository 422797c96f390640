package com.zust.backend.media.event;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import com.zust.backend.media.config.MediaModuleConfig;
import com.zust.backend.media.service.MediaStorage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class AccountMediaEventListener {

    private final MediaStorage mediaStorage;

    // Runs only after the account row is committed, off the request thread.
    @Async(MediaModuleConfig.MEDIA_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void on(AccountCreatedEvent event) {
        try {
            mediaStorage.createUserRepository(event.accountId());
        } catch (Exception e) {
            // the account stays, it just has no media directory yet
            log.error("Account media directory creation failed. accountId={}", event.accountId(), e);
            return;
        }

        if (event.avatarUrl() != null && !event.avatarUrl().isBlank()
                && !mediaStorage.downloadAvatar(event.accountId(), event.avatarUrl())) {
            log.error("Avatar download gave up, keeping the default avatar. accountId={}", event.accountId());
        }
    }
}
