package com.openonboarding.onboarding.domain.strategy;

import com.openonboarding.common.exception.ResourceNotFoundException;
import com.openonboarding.onboarding.domain.model.OnboardingSession;
import com.openonboarding.onboarding.domain.repository.OnboardingSessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;

/**
 * Shared load-apply-swap sequence. Every strategy ends with a compare-and-swap, so even a writer that
 * bypassed the lock cannot overwrite a newer version.
 */
@Slf4j
@RequiredArgsConstructor
public abstract class AbstractSessionWriteStrategy implements SessionWriteStrategy {

    public static final String SESSION_RESOURCE = "OnboardingSession";

    protected final OnboardingSessionStore store;

    protected <R> R applyOnce(String sessionId, SessionMutation<R> mutation) {
        OnboardingSession current = store.load(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException(SESSION_RESOURCE, sessionId));

        SessionMutationResult<R> result = mutation.apply(current);
        if (!result.hasUpdate()) {
            log.debug("Session {} unchanged, skipping write", sessionId);
            return result.value();
        }

        OnboardingSession stored = store.compareAndSwap(current.getVersion(), result.updated())
                .orElseThrow(() -> new OptimisticLockingFailureException(
                        "Session " + sessionId + " was modified concurrently (read version " + current.getVersion() + ")"));
        log.debug("Session {} written at version {}", sessionId, stored.getVersion());
        afterWrite(stored);
        return result.value();
    }

    /**
     * Called after a successful write with the stored snapshot.
     */
    protected void afterWrite(OnboardingSession stored) {
    }
}
