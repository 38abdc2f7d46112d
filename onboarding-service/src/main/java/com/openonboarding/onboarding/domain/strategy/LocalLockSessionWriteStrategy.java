package com.openonboarding.onboarding.domain.strategy;

import com.openonboarding.common.exception.BusinessException;
import com.openonboarding.common.exception.ServiceUnavailableException;
import com.openonboarding.onboarding.domain.model.OnboardingSession;
import com.openonboarding.onboarding.domain.repository.OnboardingSessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One {@link ReentrantLock} per session id. Suitable when a single instance owns all sessions.
 */
@Slf4j
@Component("local")
public class LocalLockSessionWriteStrategy extends AbstractSessionWriteStrategy {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Value("${onboarding.session.lock.wait-ms:5000}")
    private long lockWaitMs;

    public LocalLockSessionWriteStrategy(OnboardingSessionStore store) {
        super(store);
    }

    @Override
    public <R> R execute(String sessionId, SessionMutation<R> mutation) {
        ReentrantLock lock = locks.computeIfAbsent(sessionId, id -> new ReentrantLock());
        try {
            if (!lock.tryLock(lockWaitMs, TimeUnit.MILLISECONDS)) {
                throw new ServiceUnavailableException(
                        "Session " + sessionId + " is busy. Please try again.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException("Session update interrupted", e, "SESSION_UPDATE_INTERRUPTED");
        }

        try {
            log.debug("Acquired local lock for session {}", sessionId);
            return applyOnce(sessionId, mutation);
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected void afterWrite(OnboardingSession stored) {
        // late callers on a terminal session only read it
        if (stored.getStatus().isTerminal()) {
            locks.remove(stored.getId());
        }
    }

    @Override
    public String getStrategyType() {
        return "LOCAL_LOCK";
    }

    int lockCount() {
        return locks.size();
    }
}
