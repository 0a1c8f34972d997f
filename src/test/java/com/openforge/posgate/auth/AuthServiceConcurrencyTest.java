package com.openforge.posgate.auth;

import com.openforge.posgate.auth.dto.AuthResponse;
import com.openforge.posgate.auth.dto.LoginRequest;
import com.openforge.posgate.common.ApiException;
import com.openforge.posgate.common.ErrorCode;
import com.openforge.posgate.domain.Role;
import com.openforge.posgate.domain.Tenant;
import com.openforge.posgate.domain.User;
import com.openforge.posgate.repository.TenantRepository;
import com.openforge.posgate.repository.UserRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs logins and refreshes for one user in parallel against the real
 * database, where the row lock and the version column both take part.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("AuthService under concurrent requests")
class AuthServiceConcurrencyTest {

    private static final int    THREADS  = 8;
    private static final String PASSWORD = "parallel-password";

    @Autowired private AuthService         authService;
    @Autowired private UserRepository      userRepository;
    @Autowired private TenantRepository    tenantRepository;
    @Autowired private PasswordEncoder     passwordEncoder;
    @Autowired private TransactionTemplate transactionTemplate;

    private ExecutorService pool;
    private String          userId;
    private String          email;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(THREADS);

        String suffix = UUID.randomUUID().toString().substring(0, 8);
        Tenant tenant = new Tenant();
        tenant.setTenantId("tenant_PAR_" + suffix);
        tenant.setName("Parallel " + suffix);
        tenant.setStatus(Tenant.Status.ACTIVE);
        tenant.setPlan(Tenant.Plan.BASIC);
        tenantRepository.save(tenant);

        User user = new User();
        user.setUserId("user_par_" + suffix);
        user.setTenantId(tenant.getTenantId());
        user.setEmail("par_" + suffix + "@example.com");
        user.setPasswordHash(passwordEncoder.encode(PASSWORD));
        user.setRole(Role.SHOP_ADMIN);
        user.setStatus(User.Status.ACTIVE);
        user.setFirstName("Parallel");
        userRepository.save(user);

        userId = user.getUserId();
        email = user.getEmail();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    /** Releases every task at once and collects each outcome, success or exception. */
    private <T> List<Object> race(Callable<T> task) throws InterruptedException {
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<T>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            futures.add(pool.submit(() -> {
                startLatch.await();
                return task.call();
            }));
        }
        startLatch.countDown();
        List<Object> outcomes = new ArrayList<>();
        for (Future<T> future : futures) {
            try {
                outcomes.add(future.get(60, TimeUnit.SECONDS));
            } catch (ExecutionException e) {
                outcomes.add(e.getCause());
            } catch (TimeoutException e) {
                outcomes.add(e);
            }
        }
        return outcomes;
    }

    private int storedSessions() {
        Integer count = transactionTemplate.execute(status ->
                userRepository.findByUserId(userId).orElseThrow().getRefreshTokens().size());
        return count == null ? 0 : count;
    }

    @Test
    @DisplayName("parallel logins all succeed and the session cap still holds")
    void parallelLogins() throws Exception {
        List<Object> outcomes = race(() ->
                authService.login(new LoginRequest(email, PASSWORD, null), "10.0.0.9"));

        assertThat(outcomes).hasSize(THREADS).allSatisfy(outcome ->
                assertThat(outcome).isInstanceOf(AuthResponse.class));
        assertThat(outcomes).extracting(outcome -> ((AuthResponse) outcome).refreshToken())
                .doesNotHaveDuplicates();
        assertThat(storedSessions()).isEqualTo(5);
    }

    @Test
    @DisplayName("one refresh token rotates exactly once under parallel use")
    void parallelRefresh() throws Exception {
        String refreshToken = authService.login(new LoginRequest(email, PASSWORD, null), "10.0.0.9")
                .refreshToken();

        List<Object> outcomes = race(() -> authService.refresh(refreshToken, "10.0.0.9"));

        assertThat(outcomes).filteredOn(AuthResponse.class::isInstance).hasSize(1);
        assertThat(outcomes).filteredOn(ApiException.class::isInstance)
                .hasSize(THREADS - 1)
                .allSatisfy(failure ->
                        assertThat(((ApiException) failure).getCode()).isEqualTo(ErrorCode.TOKEN_INVALID));
        assertThat(storedSessions()).isEqualTo(1);
    }
}
