package com.openonboarding.onboarding.domain.repository;

import com.openonboarding.onboarding.domain.model.OnboardingSession;
import com.openonboarding.onboarding.domain.model.SessionStatus;
import com.openonboarding.onboarding.support.OnboardingFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryOnboardingSessionStoreTest {

    private final InMemoryOnboardingSessionStore store = new InMemoryOnboardingSessionStore();

    @Test
    @DisplayName("Saved session can be loaded")
    void save_thenLoad() {
        store.save(OnboardingFixtures.session("s1"));

        assertThat(store.load("s1")).get().extracting(OnboardingSession::getHotelId).isEqualTo("hotel-1");
        assertThat(store.load("missing")).isEmpty();
    }

    @Test
    @DisplayName("Saving an existing id fails")
    void save_throws_whenIdExists() {
        store.save(OnboardingFixtures.session("s1"));

        assertThatThrownBy(() -> store.save(OnboardingFixtures.session("s1")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Compare-and-swap bumps the version when the read version matches")
    void compareAndSwap_success() {
        // given
        OnboardingSession current = store.save(OnboardingFixtures.session("s1"));

        // when
        Optional<OnboardingSession> stored = store.compareAndSwap(0L,
                current.toBuilder().qualityScore(42).build());

        // then
        assertThat(stored).get().satisfies(session -> {
            assertThat(session.getVersion()).isEqualTo(1L);
            assertThat(session.getQualityScore()).isEqualTo(42);
        });
        assertThat(store.load("s1")).get().extracting(OnboardingSession::getVersion).isEqualTo(1L);
    }

    @Test
    @DisplayName("Stale version is rejected and the stored session is unchanged")
    void compareAndSwap_conflict() {
        // given
        OnboardingSession current = store.save(OnboardingFixtures.session("s1"));
        store.compareAndSwap(0L, current.toBuilder().qualityScore(10).build());

        // when
        Optional<OnboardingSession> result = store.compareAndSwap(0L, current.toBuilder().qualityScore(99).build());

        // then
        assertThat(result).isEmpty();
        assertThat(store.load("s1")).get().extracting(OnboardingSession::getQualityScore).isEqualTo(10);
    }

    @Test
    @DisplayName("Only active sessions past their expiry are returned, oldest first")
    void findActiveExpiredBefore_filters() {
        // given
        OnboardingSession base = OnboardingFixtures.session("base");
        store.save(base.toBuilder().id("late").expiresAt(OnboardingFixtures.NOW.plus(Duration.ofHours(2))).build());
        store.save(base.toBuilder().id("early").expiresAt(OnboardingFixtures.NOW.plus(Duration.ofHours(1))).build());
        store.save(base.toBuilder().id("fresh").expiresAt(OnboardingFixtures.NOW.plus(Duration.ofDays(7))).build());
        store.save(base.toBuilder().id("done").status(SessionStatus.COMPLETED)
                .expiresAt(OnboardingFixtures.NOW).build());

        // when / then
        assertThat(store.findActiveExpiredBefore(OnboardingFixtures.NOW.plus(Duration.ofHours(3))))
                .extracting(OnboardingSession::getId)
                .containsExactly("early", "late");
    }

    @Test
    @DisplayName("Latest active session of the same hotel and owner is found")
    void findLatestActive_matchesHotelAndOwner() {
        // given
        OnboardingSession base = OnboardingFixtures.session("base");
        store.save(base.toBuilder().id("older").build());
        store.save(base.toBuilder().id("newer").createdAt(OnboardingFixtures.NOW.plus(Duration.ofHours(1))).build());
        store.save(base.toBuilder().id("done").status(SessionStatus.COMPLETED)
                .createdAt(OnboardingFixtures.NOW.plus(Duration.ofHours(2))).build());
        store.save(base.toBuilder().id("other-owner").ownerId("owner-2")
                .createdAt(OnboardingFixtures.NOW.plus(Duration.ofHours(3))).build());

        // when / then
        assertThat(store.findLatestActive("hotel-1", "owner-1")).get()
                .extracting(OnboardingSession::getId).isEqualTo("newer");
        assertThat(store.findLatestActive("hotel-2", "owner-1")).isEmpty();
    }
}
