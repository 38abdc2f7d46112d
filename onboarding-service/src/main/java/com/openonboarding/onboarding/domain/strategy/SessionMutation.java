package com.openonboarding.onboarding.domain.strategy;

import com.openonboarding.onboarding.domain.model.OnboardingSession;

/**
 * The read-validate-merge step of a session write. Receives the current snapshot and decides what, if
 * anything, to store. Must be free of side effects because optimistic writers may run it more than once.
 *
 * @param <R> value handed back to the caller
 */
@FunctionalInterface
public interface SessionMutation<R> {

    SessionMutationResult<R> apply(OnboardingSession current);
}
