package com.openonboarding.onboarding.domain.repository;

import com.openonboarding.onboarding.domain.model.OnboardingSession;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable home of onboarding sessions.
 *
 * Writers never overwrite blindly: {@link #compareAndSwap} only succeeds when the stored version still
 * equals the version the writer read, and bumps the version by one.
 */
public interface OnboardingSessionStore {

    Optional<OnboardingSession> load(String sessionId);

    /**
     * Stores a new session.
     *
     * @throws IllegalStateException when a session with the same id already exists
     */
    OnboardingSession save(OnboardingSession session);

    /**
     * @return the stored session with its new version, or empty when the version no longer matches
     */
    Optional<OnboardingSession> compareAndSwap(long expectedVersion, OnboardingSession updated);

    List<OnboardingSession> findActiveExpiredBefore(Instant now);

    /**
     * @return the most recently created ACTIVE session of this hotel and owner, expired or not
     */
    Optional<OnboardingSession> findLatestActive(String hotelId, String ownerId);
}
