package com.openonboarding.onboarding.domain.strategy;

import com.openonboarding.common.exception.ResourceNotFoundException;
import com.openonboarding.common.exception.ServiceUnavailableException;
import com.openonboarding.onboarding.domain.model.OnboardingSession;
import com.openonboarding.onboarding.domain.model.SessionStatus;
import com.openonboarding.onboarding.domain.repository.InMemoryOnboardingSessionStore;
import com.openonboarding.onboarding.support.OnboardingFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link LocalLockSessionWriteStrategy}.
 * Verifies that concurrent writers to one session are serialized and that a busy session fails fast.
 */
class LocalLockSessionWriteStrategyTest {

    private InMemoryOnboardingSessionStore store;
    private LocalLockSessionWriteStrategy strategy;

    @BeforeEach
    void setUp() {
        store = new InMemoryOnboardingSessionStore();
        strategy = new LocalLockSessionWriteStrategy(store);
        ReflectionTestUtils.setField(strategy, "lockWaitMs", 5000L);
        store.save(OnboardingFixtures.session("s1"));
    }

    @Test
    @DisplayName("Concurrent increments on one session are all applied")
    void execute_serializesConcurrentWriters() throws Exception {
        // given
        int writers = 10;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < writers; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return strategy.execute("s1", current -> {
                    OnboardingSession next = current.toBuilder().qualityScore(current.getQualityScore() + 1).build();
                    return SessionMutationResult.write(next, next.getQualityScore());
                });
            }));
        }
        start.countDown();
        for (Future<Integer> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // then
        OnboardingSession stored = store.load("s1").orElseThrow();
        assertThat(stored.getQualityScore()).isEqualTo(writers);
        assertThat(stored.getVersion()).isEqualTo(writers);
    }

    @Test
    @DisplayName("Writer gives up when the session stays locked past the wait time")
    void execute_throws_whenSessionBusy() throws Exception {
        // given
        ReflectionTestUtils.setField(strategy, "lockWaitMs", 50L);
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<Object> holder = executor.submit(() -> strategy.execute("s1", current -> {
            holding.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return SessionMutationResult.unchanged(null);
        }));
        holding.await(5, TimeUnit.SECONDS);

        // when / then
        try {
            assertThatThrownBy(() -> strategy.execute("s1", current -> SessionMutationResult.unchanged(null)))
                    .isInstanceOf(ServiceUnavailableException.class)
                    .extracting("errorCode").isEqualTo("SERVICE_UNAVAILABLE");
        } finally {
            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("Unknown session is reported as not found")
    void execute_throws_whenSessionMissing() {
        assertThatThrownBy(() -> strategy.execute("missing", current -> SessionMutationResult.unchanged(null)))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("missing");
    }

    @Test
    @DisplayName("Lock is dropped once the session reaches a terminal state")
    void execute_releasesLock_whenSessionTerminal() {
        strategy.execute("s1", current -> SessionMutationResult.write(
                current.toBuilder().status(SessionStatus.COMPLETED).build(), null));

        assertThat(strategy.lockCount()).isZero();
    }

    @Test
    @DisplayName("Unchanged mutation does not bump the version")
    void execute_noWrite_whenUnchanged() {
        String value = strategy.execute("s1", current -> SessionMutationResult.unchanged("same"));

        assertThat(value).isEqualTo("same");
        assertThat(store.load("s1").orElseThrow().getVersion()).isZero();
    }
}
