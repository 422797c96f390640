package com.zust.backend.auth.identity.verification.event;

import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import com.zust.backend.auth.identity.verification.service.VerificationMailSender;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class VerificationMailEventListener {

    private final VerificationMailSender mailSender;

    // A rolled back registration sends nothing.
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void on(VerificationMailRequestedEvent event) {
        try {
            mailSender.sendVerificationLink(event.email(), event.username(), event.token());
        } catch (Exception e) {
            // the account exists either way, the user can ask for a resend
            log.error("Verification mail failed. email={}", event.email(), e);
        }
    }
}
