package com.openonboarding.onboarding.domain.strategy;

import com.openonboarding.common.exception.BusinessException;
import com.openonboarding.common.exception.ServiceUnavailableException;
import com.openonboarding.common.util.Constants;
import com.openonboarding.onboarding.domain.repository.OnboardingSessionStore;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Session writes guarded by a Redisson lock so that several service instances can share one store.
 *
 * The lease bounds how long a crashed holder can block a session; the trailing compare-and-swap still
 * rejects a write from a holder whose lease ran out mid-update.
 */
@Slf4j
@Component("distributed")
public class DistributedLockSessionWriteStrategy extends AbstractSessionWriteStrategy {

    private final RedissonClient redissonClient;

    @Value("${onboarding.session.lock.wait-ms:5000}")
    private long lockWaitMs;

    @Value("${onboarding.session.lock.lease-ms:30000}")
    private long lockLeaseMs;

    public DistributedLockSessionWriteStrategy(OnboardingSessionStore store, RedissonClient redissonClient) {
        super(store);
        this.redissonClient = redissonClient;
    }

    @Override
    public <R> R execute(String sessionId, SessionMutation<R> mutation) {
        String lockKey = buildLockKey(sessionId);
        RLock lock = redissonClient.getLock(lockKey);

        try {
            boolean acquired = lock.tryLock(lockWaitMs, lockLeaseMs, TimeUnit.MILLISECONDS);
            if (!acquired) {
                throw new ServiceUnavailableException(
                        "Unable to acquire lock for session " + sessionId + ". Please try again.");
            }

            log.debug("Acquired distributed lock: {}", lockKey);
            return applyOnce(sessionId, mutation);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException("Session update interrupted", e, "SESSION_UPDATE_INTERRUPTED");
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Released distributed lock: {}", lockKey);
            }
        }
    }

    @Override
    public String getStrategyType() {
        return "DISTRIBUTED_LOCK";
    }

    static String buildLockKey(String sessionId) {
        return Constants.LOCK_PREFIX + sessionId;
    }
}
