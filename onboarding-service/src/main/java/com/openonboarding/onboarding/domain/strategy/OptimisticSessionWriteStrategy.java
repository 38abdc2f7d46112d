package com.openonboarding.onboarding.domain.strategy;

import com.openonboarding.onboarding.domain.repository.OnboardingSessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

/**
 * Lock-free writes: read, apply, compare-and-swap on the version. A lost race raises
 * {@link OptimisticLockingFailureException} and the whole read-apply-swap is retried against the
 * fresh state.
 */
@Slf4j
@Component("optimistic")
public class OptimisticSessionWriteStrategy extends AbstractSessionWriteStrategy {

    public OptimisticSessionWriteStrategy(OnboardingSessionStore store) {
        super(store);
    }

    @Override
    @Retryable(
            retryFor = OptimisticLockingFailureException.class,
            maxAttemptsExpression = "${onboarding.session.optimistic.max-attempts:5}",
            backoff = @Backoff(delay = 50, multiplier = 2, maxDelay = 1000)
    )
    public <R> R execute(String sessionId, SessionMutation<R> mutation) {
        return applyOnce(sessionId, mutation);
    }

    @Override
    public String getStrategyType() {
        return "OPTIMISTIC_LOCK";
    }
}
