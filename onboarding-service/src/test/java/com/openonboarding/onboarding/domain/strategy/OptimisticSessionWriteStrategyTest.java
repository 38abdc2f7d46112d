package com.openonboarding.onboarding.domain.strategy;

import com.openonboarding.onboarding.domain.model.OnboardingSession;
import com.openonboarding.onboarding.domain.repository.OnboardingSessionStore;
import com.openonboarding.onboarding.support.OnboardingFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link OptimisticSessionWriteStrategy}.
 * Retries are applied by the Spring proxy; these tests cover a single attempt.
 */
@ExtendWith(MockitoExtension.class)
class OptimisticSessionWriteStrategyTest {

    @Mock
    private OnboardingSessionStore store;

    @InjectMocks
    private OptimisticSessionWriteStrategy strategy;

    @Test
    @DisplayName("Should return the mutation value when the swap succeeds")
    void execute_success_whenVersionMatches() {
        // given
        OnboardingSession session = OnboardingFixtures.session("s1").toBuilder().version(3).build();
        OnboardingSession updated = session.toBuilder().qualityScore(77).build();
        given(store.load("s1")).willReturn(Optional.of(session));
        given(store.compareAndSwap(eq(3L), any())).willReturn(Optional.of(updated.toBuilder().version(4).build()));

        // when
        String result = strategy.execute("s1", current -> SessionMutationResult.write(updated, "ok"));

        // then
        assertThat(result).isEqualTo("ok");
    }

    @Test
    @DisplayName("Should signal a conflict so the attempt can be retried")
    void execute_throws_whenVersionChanged() {
        // given
        OnboardingSession session = OnboardingFixtures.session("s1");
        given(store.load("s1")).willReturn(Optional.of(session));
        given(store.compareAndSwap(eq(0L), any())).willReturn(Optional.empty());

        // when / then
        assertThatThrownBy(() -> strategy.execute("s1",
                current -> SessionMutationResult.write(current.toBuilder().qualityScore(1).build(), null)))
                .isInstanceOf(OptimisticLockingFailureException.class)
                .hasMessageContaining("modified concurrently");
    }

    @Test
    @DisplayName("Should skip the swap when nothing changed")
    void execute_noSwap_whenUnchanged() {
        // given
        given(store.load("s1")).willReturn(Optional.of(OnboardingFixtures.session("s1")));

        // when
        strategy.execute("s1", current -> SessionMutationResult.unchanged(null));

        // then
        verify(store, never()).compareAndSwap(anyLong(), any());
        assertThat(strategy.getStrategyType()).isEqualTo("OPTIMISTIC_LOCK");
    }
}
