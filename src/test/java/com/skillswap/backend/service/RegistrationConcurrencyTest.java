package com.skillswap.backend.service;

import com.skillswap.backend.exception.DuplicateFieldException;
import com.skillswap.backend.testutil.RegisterRequestBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Concurrent registrations of the same username. Not transactional: each
 * registration commits on its own, as it would in production.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Registration Concurrency Tests")
class RegistrationConcurrencyTest {

    @Autowired
    private AuthService authService;

    @Autowired
    private UserService userService;

    @Test
    @DisplayName("Only one of many concurrent identical registrations succeeds")
    void testConcurrentRegistrationSameUsername() throws Exception {
        String username = "racer-" + UUID.randomUUID().toString().substring(0, 8);
        int numThreads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch startLatch = new CountDownLatch(1);
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < numThreads; i++) {
            final int n = i;
            futures.add(executor.submit(() -> {
                startLatch.await();
                try {
                    authService.register(RegisterRequestBuilder.user(username)
                            .email(username + "-" + n + "@example.com")
                            .build());
                    successes.incrementAndGet();
                } catch (DuplicateFieldException e) {
                    assertThat(e.getFieldErrors()).containsKey("username");
                    conflicts.incrementAndGet();
                }
                return null;
            }));
        }

        startLatch.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertThat(successes.get()).isEqualTo(1);
        assertThat(conflicts.get()).isEqualTo(numThreads - 1);
        assertThat(userService.usernameTaken(username)).isTrue();
    }
}
