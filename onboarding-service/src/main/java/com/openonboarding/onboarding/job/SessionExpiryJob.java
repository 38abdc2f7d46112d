package com.openonboarding.onboarding.job;

import com.openonboarding.onboarding.domain.service.OnboardingSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically marks expired ACTIVE sessions as ABANDONED. Reads of an expired session abandon it as
 * well, so the job only bounds how long a forgotten session stays ACTIVE in the store.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionExpiryJob {

    private final OnboardingSessionService sessionService;

    @Value("${onboarding.session.expiry-sweep-enabled:true}")
    private boolean sweepEnabled;

    @Scheduled(fixedDelayString = "${onboarding.session.expiry-sweep-interval-ms:300000}",
            initialDelayString = "${onboarding.session.expiry-sweep-initial-delay-ms:60000}")
    public void abandonExpiredSessions() {
        if (!sweepEnabled) return;
        int abandoned = sessionService.sweepExpiredSessions();
        if (abandoned > 0) {
            log.debug("Expiry job abandoned {} session(s)", abandoned);
        }
    }
}
