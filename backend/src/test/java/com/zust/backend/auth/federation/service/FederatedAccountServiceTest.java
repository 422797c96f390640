package com.zust.backend.auth.federation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;

import com.zust.backend.auth.domain.Account;
import com.zust.backend.auth.federation.ExternalIdentity;
import com.zust.backend.auth.federation.service.FederatedAccountService.ConcurrentRegistrationException;
import com.zust.backend.auth.repo.AccountRepository;
import com.zust.backend.global.ApiException;
import com.zust.backend.global.ErrorCode;
import com.zust.backend.security.session.SessionAuthority;

@DisplayName("[Auth][Federation] FederatedAccountService")
class FederatedAccountServiceTest {

    @Nested
    @DisplayName("username derivation")
    class UsernameFor {

        @Test
        @DisplayName("display name is used as is when it fits")
        void display_name() {
            assertThat(FederatedAccountService.usernameFor(identity("octocat", "o@zust.test"))).isEqualTo("octocat");
        }

        @Test
        @DisplayName("display name longer than 20 characters is cut")
        void long_display_name() {
            String username = FederatedAccountService.usernameFor(
                    identity("  Maximilian Alexander Longname  ", "m@zust.test"));

            assertThat(username).isEqualTo("Maximilian Alexander");
            assertThat(username).hasSize(20);
        }

        @Test
        @DisplayName("no display name → local part of the email")
        void falls_back_to_email() {
            assertThat(FederatedAccountService.usernameFor(identity(null, "jane.doe@gmail.com"))).isEqualTo("jane.doe");
            assertThat(FederatedAccountService.usernameFor(identity(" ", "jane.doe@gmail.com"))).isEqualTo("jane.doe");
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("insert failures")
    class InsertFailures {

        @Mock AccountRepository accountRepository;
        @Mock SessionAuthority sessionAuthority;
        @Mock ApplicationEventPublisher eventPublisher;

        private FederatedAccountService service;

        @BeforeEach
        void setUp() {
            Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
            service = new FederatedAccountService(accountRepository, sessionAuthority, eventPublisher, clock);
            given(accountRepository.findByOauthProviderAndOauthProviderId(anyString(), anyString()))
                    .willReturn(Optional.empty());
        }

        @Test
        @DisplayName("unique key collision → ConcurrentRegistrationException, the broker retries")
        void unique_key_is_a_race() {
            given(accountRepository.saveAndFlush(any(Account.class))).willThrow(violation(
                    "Duplicate entry 'github-583231' for key 'account.uq_account_oauth_identity'"));

            assertThatThrownBy(() -> service.loginOrRegister("github", identity("octocat", "octo@zust.test")))
                    .isInstanceOf(ConcurrentRegistrationException.class);
        }

        @Test
        @DisplayName("any other integrity violation propagates unchanged, it is not a race")
        void other_violation_is_not_a_race() {
            DataIntegrityViolationException tooLong = violation("Data too long for column 'oauth_provider_id' at row 1");
            given(accountRepository.saveAndFlush(any(Account.class))).willThrow(tooLong);

            assertThatThrownBy(() -> service.loginOrRegister("github", identity("octocat", "octo@zust.test")))
                    .isSameAs(tooLong);
        }

        @Test
        @DisplayName("email longer than the column → OAUTH_EMAIL_TOO_LONG before any insert")
        void email_too_long() {
            String email = "b".repeat(33) + "@zust.io";

            assertThatThrownBy(() -> service.loginOrRegister("github", identity("octocat", email)))
                    .isInstanceOfSatisfying(ApiException.class,
                            e -> assertThat(e.getCode()).isEqualTo(ErrorCode.OAUTH_EMAIL_TOO_LONG.name()));
            verify(accountRepository, never()).saveAndFlush(any());
        }
    }

    private static ExternalIdentity identity(String displayName, String email) {
        return new ExternalIdentity("42", displayName, null, email);
    }

    private static DataIntegrityViolationException violation(String sqlMessage) {
        return new DataIntegrityViolationException("could not execute statement",
                new SQLIntegrityConstraintViolationException(sqlMessage));
    }
}
