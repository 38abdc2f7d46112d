package com.openonboarding.onboarding.domain.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openonboarding.onboarding.domain.model.OnboardingSession;
import com.openonboarding.onboarding.domain.model.SessionStatus;
import com.openonboarding.onboarding.domain.model.StepId;
import com.openonboarding.onboarding.domain.service.StepPayloadCodec;
import com.openonboarding.onboarding.support.OnboardingFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link JpaOnboardingSessionStore}.
 * Verifies entity mapping and the guarded update used for compare-and-swap.
 */
@ExtendWith(MockitoExtension.class)
class JpaOnboardingSessionStoreTest {

    @Mock
    private OnboardingSessionRepository repository;

    private StepPayloadCodec codec;
    private JpaOnboardingSessionStore store;

    @BeforeEach
    void setUp() {
        codec = new StepPayloadCodec(new ObjectMapper());
        store = new JpaOnboardingSessionStore(repository, codec);
    }

    @Test
    @DisplayName("Should map the stored row back to a session with its draft")
    void load_mapsEntity() {
        // given
        OnboardingSession original = OnboardingFixtures.session("s1").toBuilder()
                .draft(OnboardingFixtures.completeDraft())
                .completedSteps(EnumSet.of(StepId.AMENITIES, StepId.ROOMS))
                .qualityScore(88)
                .version(4)
                .build();
        given(repository.findById("s1")).willReturn(Optional.of(OnboardingSessionEntity.builder()
                .id("s1")
                .hotelId("hotel-1")
                .ownerId("owner-1")
                .status(SessionStatus.ACTIVE)
                .draftJson(codec.writeDraft(original.getDraft()))
                .completedSteps("amenities,rooms")
                .qualityScore(88)
                .version(4)
                .createdAt(original.getCreatedAt())
                .updatedAt(original.getUpdatedAt())
                .expiresAt(original.getExpiresAt())
                .build()));

        // when
        OnboardingSession loaded = store.load("s1").orElseThrow();

        // then
        assertThat(loaded.getDraft()).isEqualTo(original.getDraft());
        assertThat(loaded.getCompletedSteps()).containsExactly(StepId.AMENITIES, StepId.ROOMS);
        assertThat(loaded.getVersion()).isEqualTo(4L);
        assertThat(loaded.getQualityScore()).isEqualTo(88);
    }

    @Test
    @DisplayName("Should insert a new row for a new session")
    void save_insertsEntity() {
        // given
        given(repository.existsById("s1")).willReturn(false);

        // when
        store.save(OnboardingFixtures.session("s1"));

        // then
        ArgumentCaptor<OnboardingSessionEntity> captor = ArgumentCaptor.forClass(OnboardingSessionEntity.class);
        verify(repository).save(captor.capture());
        assertThat(captor.getValue().getDraftJson()).isEqualTo("{}");
        assertThat(captor.getValue().getCompletedSteps()).isEmpty();
        assertThat(captor.getValue().getStatus()).isEqualTo(SessionStatus.ACTIVE);
    }

    @Test
    @DisplayName("Should refuse to overwrite an existing row")
    void save_throws_whenExists() {
        given(repository.existsById("s1")).willReturn(true);

        assertThatThrownBy(() -> store.save(OnboardingFixtures.session("s1")))
                .isInstanceOf(IllegalStateException.class);
        verify(repository, never()).save(any());
    }

    @Test
    @DisplayName("Should return the next version when the guarded update hits the row")
    void compareAndSwap_success() {
        // given
        OnboardingSession updated = OnboardingFixtures.session("s1").toBuilder()
                .version(3)
                .completedSteps(EnumSet.of(StepId.IMAGES))
                .build();
        given(repository.updateIfVersionMatches(eq("s1"), eq(3L), any(), anyString(), eq("images"),
                anyInt(), any(), any())).willReturn(1);

        // when
        Optional<OnboardingSession> stored = store.compareAndSwap(3L, updated);

        // then
        assertThat(stored).get().extracting(OnboardingSession::getVersion).isEqualTo(4L);
    }

    @Test
    @DisplayName("Should report a conflict when no row matched the version")
    void compareAndSwap_conflict() {
        given(repository.updateIfVersionMatches(eq("s1"), eq(3L), any(), anyString(), anyString(),
                anyInt(), any(), any())).willReturn(0);

        assertThat(store.compareAndSwap(3L, OnboardingFixtures.session("s1"))).isEmpty();
    }

    @Test
    @DisplayName("Should query active sessions past expiry")
    void findActiveExpiredBefore_queriesActiveOnly() {
        given(repository.findByStatusAndExpiresAtBeforeOrderByExpiresAtAsc(SessionStatus.ACTIVE, OnboardingFixtures.NOW))
                .willReturn(List.of());

        assertThat(store.findActiveExpiredBefore(OnboardingFixtures.NOW)).isEmpty();
    }

    @Test
    @DisplayName("Completed steps are stored as comma-separated wire ids")
    void steps_roundTripThroughColumn() {
        assertThat(JpaOnboardingSessionStore.writeSteps(EnumSet.of(StepId.PROPERTY_INFO, StepId.ROOMS)))
                .isEqualTo("property-info,rooms");
        assertThat(JpaOnboardingSessionStore.readSteps(" amenities , business-features "))
                .containsExactly(StepId.AMENITIES, StepId.BUSINESS_FEATURES);
        assertThat(JpaOnboardingSessionStore.readSteps(null)).isEmpty();
    }

    @Test
    @DisplayName("Should look up the latest active session by hotel and owner")
    void findLatestActive_queriesActiveStatus() {
        // given
        OnboardingSession session = OnboardingFixtures.session("s1");
        given(repository.findFirstByHotelIdAndOwnerIdAndStatusOrderByCreatedAtDesc(
                "hotel-1", "owner-1", SessionStatus.ACTIVE))
                .willReturn(Optional.of(OnboardingSessionEntity.builder()
                        .id("s1")
                        .hotelId("hotel-1")
                        .ownerId("owner-1")
                        .status(SessionStatus.ACTIVE)
                        .draftJson("{}")
                        .completedSteps("")
                        .createdAt(session.getCreatedAt())
                        .updatedAt(session.getUpdatedAt())
                        .expiresAt(session.getExpiresAt())
                        .build()));

        // when
        Optional<OnboardingSession> found = store.findLatestActive("hotel-1", "owner-1");

        // then
        assertThat(found).get().satisfies(loaded -> {
            assertThat(loaded.getId()).isEqualTo("s1");
            assertThat(loaded.getDraft()).isEmpty();
            assertThat(loaded.getExpiresAt()).isEqualTo(session.getExpiresAt());
        });
    }
}
