package com.openonboarding.onboarding.domain.strategy;

import com.openonboarding.onboarding.domain.model.OnboardingSession;

/**
 * @param updated session to store, or null to leave the stored session untouched
 * @param value   result returned to the caller of the write
 */
public record SessionMutationResult<R>(OnboardingSession updated, R value) {

    public static <R> SessionMutationResult<R> write(OnboardingSession updated, R value) {
        return new SessionMutationResult<>(updated, value);
    }

    public static <R> SessionMutationResult<R> unchanged(R value) {
        return new SessionMutationResult<>(null, value);
    }

    public boolean hasUpdate() {
        return updated != null;
    }
}
