package com.zust.backend.account;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import com.zust.backend.account.domain.Subscription;
import com.zust.backend.auth.AbstractAuthIntegrationTest;
import com.zust.backend.auth.domain.Account;
import com.zust.backend.auth.support.AuthFlowSupport;
import com.zust.backend.auth.support.AuthHttpSupport;
import com.zust.backend.global.ErrorCode;
import com.zust.backend.infra.TestClockConfig;

/**
 * POST /subscribe and DELETE /subscribe, body {"subscriberId":..., "subscribeToId":...}.
 */
@DisplayName("[Account] subscriptions")
class SubscriptionIntegrationTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;
    @Autowired JdbcTemplate jdbc;

    private Account me;
    private Account creator;
    private String accessToken;

    @BeforeEach
    void seedAndLogin() throws Exception {
        me = createDefaultActiveUser();
        creator = createActiveUser("creator@zust.test", "creator", PASSWORD);
        accessToken = AuthFlowSupport.loginOk(mvc, USERNAME, PASSWORD).accessToken();
    }

    @Test
    @DisplayName("subscribe → 201 with the pair and its time, stored once")
    void subscribe_ok() throws Exception {
        performSubscribe(me.getId(), creator.getId(), accessToken)
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.subscriberId").value(me.getId().toString()))
                .andExpect(jsonPath("$.subscribeToId").value(creator.getId().toString()))
                .andExpect(jsonPath("$.subscribedAt").value(TestClockConfig.TEST_START.toString()));

        assertThat(subscriptionRepository.existsById(new Subscription.Key(me.getId(), creator.getId()))).isTrue();
        assertThat(subscriptionRepository.countBySubscribeToId(creator.getId())).isEqualTo(1);
    }

    @Test
    @DisplayName("same pair twice → 400 ALREADY_SUBSCRIBED")
    void subscribe_twice() throws Exception {
        performSubscribe(me.getId(), creator.getId(), accessToken).andExpect(status().isCreated());

        AuthHttpSupport.expectErrorWithCode(performSubscribe(me.getId(), creator.getId(), accessToken),
                ErrorCode.ALREADY_SUBSCRIBED);
    }

    @Test
    @DisplayName("subscribing to yourself → 400 SUBSCRIBE_SELF")
    void subscribe_self() throws Exception {
        AuthHttpSupport.expectErrorWithCode(performSubscribe(me.getId(), me.getId(), accessToken),
                ErrorCode.SUBSCRIBE_SELF);
    }

    @Test
    @DisplayName("unknown or non-ACTIVE target → 404 SUBSCRIPTION_TARGET_NOT_FOUND")
    void subscribe_missing_target() throws Exception {
        AuthHttpSupport.expectErrorWithCode(performSubscribe(me.getId(), UUID.randomUUID(), accessToken),
                ErrorCode.SUBSCRIPTION_TARGET_NOT_FOUND);

        jdbc.update("update account set status = 'BANNED' where account_id = ?", creator.getId().toString());
        AuthHttpSupport.expectErrorWithCode(performSubscribe(me.getId(), creator.getId(), accessToken),
                ErrorCode.SUBSCRIPTION_TARGET_NOT_FOUND);
    }

    @Test
    @DisplayName("subscriberId other than the token's account → 400 ACCOUNT_ID_MISMATCH")
    void subscribe_for_someone_else() throws Exception {
        AuthHttpSupport.expectErrorWithCode(performSubscribe(creator.getId(), me.getId(), accessToken),
                ErrorCode.ACCOUNT_ID_MISMATCH);

        assertThat(subscriptionRepository.count()).isZero();
    }

    @Test
    @DisplayName("missing subscribeToId → 400 VALIDATION_ERROR")
    void subscribe_incomplete_body() throws Exception {
        AuthHttpSupport.expectErrorWithCode(mvc.perform(json(post("/subscribe"), accessToken,
                "{\"subscriberId\":\"" + me.getId() + "\"}")), ErrorCode.VALIDATION_ERROR);
    }

    @Test
    @DisplayName("without a token → 401 AUTH_REQUIRED")
    void subscribe_requires_authentication() throws Exception {
        AuthHttpSupport.expectErrorWithCode(performSubscribe(me.getId(), creator.getId(), null),
                ErrorCode.AUTH_REQUIRED);
    }

    @Test
    @DisplayName("unsubscribe → 200, pair removed; again → still 200")
    void unsubscribe_ok() throws Exception {
        subscriptionRepository.saveAndFlush(Subscription.of(me.getId(), creator.getId(), clock.instant()));

        performUnsubscribe(me.getId(), creator.getId(), accessToken)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Unsubscription successfully"));
        assertThat(subscriptionRepository.count()).isZero();

        performUnsubscribe(me.getId(), creator.getId(), accessToken)
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("unsubscribe on behalf of someone else → 400 ACCOUNT_ID_MISMATCH, their subscription stays")
    void unsubscribe_for_someone_else() throws Exception {
        subscriptionRepository.saveAndFlush(Subscription.of(creator.getId(), me.getId(), clock.instant()));

        AuthHttpSupport.expectErrorWithCode(performUnsubscribe(creator.getId(), me.getId(), accessToken),
                ErrorCode.ACCOUNT_ID_MISMATCH);

        assertThat(subscriptionRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("deleting an account removes its subscriptions in both directions")
    void cascade_on_account_delete() throws Exception {
        subscriptionRepository.saveAndFlush(Subscription.of(me.getId(), creator.getId(), clock.instant()));
        subscriptionRepository.saveAndFlush(Subscription.of(creator.getId(), me.getId(), clock.instant()));

        jdbc.update("delete from account where account_id = ?", creator.getId().toString());

        assertThat(subscriptionRepository.count()).isZero();
    }

    private ResultActions performSubscribe(UUID subscriberId, UUID subscribeToId, String accessTokenOrNull) throws Exception {
        return mvc.perform(json(post("/subscribe"), accessTokenOrNull, body(subscriberId, subscribeToId)));
    }

    private ResultActions performUnsubscribe(UUID subscriberId, UUID subscribeToId, String accessTokenOrNull) throws Exception {
        return mvc.perform(json(delete("/subscribe"), accessTokenOrNull, body(subscriberId, subscribeToId)));
    }

    private static MockHttpServletRequestBuilder json(MockHttpServletRequestBuilder req, String accessTokenOrNull, String body) {
        return AuthHttpSupport.withBearer(req, accessTokenOrNull)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body);
    }

    private static String body(UUID subscriberId, UUID subscribeToId) {
        return """
                {"subscriberId":"%s","subscribeToId":"%s"}
                """.formatted(subscriberId, subscribeToId);
    }
}
