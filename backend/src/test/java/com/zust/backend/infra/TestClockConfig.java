package com.zust.backend.infra;

import java.time.Clock;
import java.time.Instant;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Replaces the application's UTC clock in integration tests.
 * {@link AbstractIntegrationTest} puts it back to {@link #TEST_START} before every test.
 */
@TestConfiguration
public class TestClockConfig {

    public static final Instant TEST_START = Instant.parse("2026-01-01T00:00:00Z");
    public static final MutableClock TEST_CLOCK = MutableClock.startingAt(TEST_START);

    public static void reset() {
        TEST_CLOCK.set(TEST_START);
    }

    @Bean
    @Primary
    Clock testClock() {
        return TEST_CLOCK;
    }
}
