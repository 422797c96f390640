package com.zust.backend.infra;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import lombok.extern.slf4j.Slf4j;

/**
 * Base of every Spring integration test.
 *
 * <ul>
 *   <li>Database: a real MySQL 8 in a Testcontainer, started once per JVM and migrated by Flyway.
 *       Constraint names, CHECK constraints and column sizes behave exactly as in production.</li>
 *   <li>Mail: {@link JavaMailSender} is a Mockito mock, tests verify what was sent</li>
 *   <li>Clock: {@link TestClockConfig#TEST_CLOCK}, reset before each test</li>
 *   <li>OAuth: a {@link StubOAuthProvider} is registered next to github and google</li>
 * </ul>
 *
 * Without a Docker daemon the subclasses are reported as skipped instead of failing at startup.
 * All subclasses share one cached ApplicationContext as long as they add no context configuration.
 *
 * <pre>
 * mvn -pl backend test                                   # everything
 * mvn -pl backend test -Dtest='*IntegrationTest'         # Docker-backed only
 * mvn -pl backend test -Dtest=AuthLoginIntegrationTest   # one class
 * </pre>
 */
@Slf4j
@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import({TestClockConfig.class, StubOAuthProviderConfig.class})
public abstract class AbstractIntegrationTest {

    private static final String MYSQL_IMAGE = "mysql:8.0.36";
    private static final String MYSQL_DB = "zust_test";
    private static final String MYSQL_USER = "zust";
    private static final String MYSQL_PASSWORD = "zust";

    private static final AtomicBoolean STARTED = new AtomicBoolean(false);

    static final MySQLContainer<?> MYSQL = new MySQLContainer<>(MYSQL_IMAGE)
            .withDatabaseName(MYSQL_DB)
            .withUsername(MYSQL_USER)
            .withPassword(MYSQL_PASSWORD)
            .withStartupAttempts(3)
            .withStartupTimeout(Duration.ofMinutes(2));

    @MockBean
    protected JavaMailSender mailSender;

    @BeforeEach
    void resetTestClock() {
        TestClockConfig.reset();
    }

    @DynamicPropertySource
    static void overrideProps(DynamicPropertyRegistry r) {
        startContainerOnce();
        TestDynamicProperties.overrideProps(r, MYSQL);
    }

    // not in a static initializer: a class skipped for lack of Docker must not touch the container
    private static void startContainerOnce() {
        if (!STARTED.compareAndSet(false, true)) {
            return;
        }

        try {
            MYSQL.start();
            log.info("[TEST] MySQL started. jdbcUrl={}, mapping={}:{} -> container:{}",
                    MYSQL.getJdbcUrl(), MYSQL.getHost(),
                    MYSQL.getMappedPort(MySQLContainer.MYSQL_PORT), MySQLContainer.MYSQL_PORT);
        } catch (Exception e) {
            log.error("Testcontainer init failed", e);
            throw new IllegalStateException("Testcontainer init failed", e);
        }
    }
}
