package com.openonboarding.onboarding.domain.repository;

import com.openonboarding.onboarding.domain.model.OnboardingSession;
import com.openonboarding.onboarding.domain.model.SessionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local store for single-instance deployments and tests.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "onboarding.session.store", havingValue = "memory")
public class InMemoryOnboardingSessionStore implements OnboardingSessionStore {

    private final ConcurrentMap<String, OnboardingSession> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<OnboardingSession> load(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public OnboardingSession save(OnboardingSession session) {
        if (sessions.putIfAbsent(session.getId(), session) != null) {
            throw new IllegalStateException("Onboarding session " + session.getId() + " already exists");
        }
        return session;
    }

    @Override
    public Optional<OnboardingSession> compareAndSwap(long expectedVersion, OnboardingSession updated) {
        AtomicReference<OnboardingSession> stored = new AtomicReference<>();
        sessions.computeIfPresent(updated.getId(), (id, current) -> {
            if (current.getVersion() != expectedVersion) {
                log.debug("Version conflict on session {}: expected {}, found {}",
                        id, expectedVersion, current.getVersion());
                return current;
            }
            OnboardingSession next = updated.toBuilder().version(expectedVersion + 1).build();
            stored.set(next);
            return next;
        });
        return Optional.ofNullable(stored.get());
    }

    @Override
    public List<OnboardingSession> findActiveExpiredBefore(Instant now) {
        return sessions.values().stream()
                .filter(session -> session.getStatus() == SessionStatus.ACTIVE)
                .filter(session -> session.isExpiredAt(now))
                .sorted(Comparator.comparing(OnboardingSession::getExpiresAt))
                .toList();
    }

    @Override
    public Optional<OnboardingSession> findLatestActive(String hotelId, String ownerId) {
        return sessions.values().stream()
                .filter(session -> session.getStatus() == SessionStatus.ACTIVE)
                .filter(session -> session.getHotelId().equals(hotelId) && session.getOwnerId().equals(ownerId))
                .max(Comparator.comparing(OnboardingSession::getCreatedAt));
    }
}
