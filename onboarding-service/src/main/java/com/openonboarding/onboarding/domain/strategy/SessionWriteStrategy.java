package com.openonboarding.onboarding.domain.strategy;

/**
 * Serializes writes to one session.
 *
 * Implementations (bean names):
 * - local: per-session lock inside this JVM
 * - distributed: Redisson lock shared by all instances
 * - optimistic: version compare-and-swap, retried on conflict
 *
 * Writes to different sessions never wait on each other.
 */
public interface SessionWriteStrategy {

    /**
     * Loads the session, applies the mutation and stores its result as one atomic unit.
     *
     * @throws com.openonboarding.common.exception.ResourceNotFoundException when the session does not exist
     */
    <R> R execute(String sessionId, SessionMutation<R> mutation);

    /**
     * @return LOCAL_LOCK, DISTRIBUTED_LOCK or OPTIMISTIC_LOCK
     */
    String getStrategyType();
}
