package com.openonboarding.onboarding.domain.repository;

import com.openonboarding.onboarding.domain.model.OnboardingSession;
import com.openonboarding.onboarding.domain.model.SessionStatus;
import com.openonboarding.onboarding.domain.model.StepId;
import com.openonboarding.onboarding.domain.service.StepPayloadCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Relational session store. Compare-and-swap is a single guarded UPDATE, so a stale writer changes
 * zero rows instead of overwriting a newer state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "onboarding.session.store", havingValue = "jpa", matchIfMissing = true)
public class JpaOnboardingSessionStore implements OnboardingSessionStore {

    private final OnboardingSessionRepository repository;
    private final StepPayloadCodec codec;

    @Override
    @Transactional(readOnly = true)
    public Optional<OnboardingSession> load(String sessionId) {
        return repository.findById(sessionId).map(this::toSession);
    }

    @Override
    @Transactional
    public OnboardingSession save(OnboardingSession session) {
        if (repository.existsById(session.getId())) {
            throw new IllegalStateException("Onboarding session " + session.getId() + " already exists");
        }
        repository.save(toEntity(session));
        return session;
    }

    @Override
    @Transactional
    public Optional<OnboardingSession> compareAndSwap(long expectedVersion, OnboardingSession updated) {
        int rows = repository.updateIfVersionMatches(
                updated.getId(),
                expectedVersion,
                updated.getStatus(),
                codec.writeDraft(updated.getDraft()),
                writeSteps(updated.getCompletedSteps()),
                updated.getQualityScore(),
                updated.getUpdatedAt(),
                updated.getExpiresAt());
        if (rows == 0) {
            log.debug("Guarded update of session {} at version {} changed no rows", updated.getId(), expectedVersion);
            return Optional.empty();
        }
        return Optional.of(updated.toBuilder().version(expectedVersion + 1).build());
    }

    @Override
    @Transactional(readOnly = true)
    public List<OnboardingSession> findActiveExpiredBefore(Instant now) {
        return repository.findByStatusAndExpiresAtBeforeOrderByExpiresAtAsc(SessionStatus.ACTIVE, now).stream()
                .map(this::toSession)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OnboardingSession> findLatestActive(String hotelId, String ownerId) {
        return repository.findFirstByHotelIdAndOwnerIdAndStatusOrderByCreatedAtDesc(hotelId, ownerId, SessionStatus.ACTIVE)
                .map(this::toSession);
    }

    private OnboardingSession toSession(OnboardingSessionEntity entity) {
        return OnboardingSession.builder()
                .id(entity.getId())
                .hotelId(entity.getHotelId())
                .ownerId(entity.getOwnerId())
                .status(entity.getStatus())
                .draft(codec.readDraft(entity.getDraftJson()))
                .completedSteps(readSteps(entity.getCompletedSteps()))
                .qualityScore(entity.getQualityScore())
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .expiresAt(entity.getExpiresAt())
                .build();
    }

    private OnboardingSessionEntity toEntity(OnboardingSession session) {
        return OnboardingSessionEntity.builder()
                .id(session.getId())
                .hotelId(session.getHotelId())
                .ownerId(session.getOwnerId())
                .status(session.getStatus())
                .draftJson(codec.writeDraft(session.getDraft()))
                .completedSteps(writeSteps(session.getCompletedSteps()))
                .qualityScore(session.getQualityScore())
                .version(session.getVersion())
                .createdAt(session.getCreatedAt())
                .updatedAt(session.getUpdatedAt())
                .expiresAt(session.getExpiresAt())
                .build();
    }

    static String writeSteps(Set<StepId> steps) {
        return steps.stream().map(StepId::wireId).collect(Collectors.joining(","));
    }

    static Set<StepId> readSteps(String value) {
        Set<StepId> steps = EnumSet.noneOf(StepId.class);
        if (value == null || value.isBlank()) {
            return steps;
        }
        Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(StepId::fromWireId)
                .forEach(steps::add);
        return steps;
    }
}
