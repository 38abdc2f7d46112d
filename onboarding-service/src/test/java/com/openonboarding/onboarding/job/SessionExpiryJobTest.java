package com.openonboarding.onboarding.job;

import com.openonboarding.onboarding.domain.service.OnboardingSessionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SessionExpiryJobTest {

    @Mock
    private OnboardingSessionService sessionService;

    @InjectMocks
    private SessionExpiryJob job;

    @Test
    @DisplayName("Enabled job runs the expiry sweep")
    void abandonExpiredSessions_runsSweep() {
        ReflectionTestUtils.setField(job, "sweepEnabled", true);
        given(sessionService.sweepExpiredSessions()).willReturn(2);

        job.abandonExpiredSessions();

        verify(sessionService).sweepExpiredSessions();
    }

    @Test
    @DisplayName("Disabled job does nothing")
    void abandonExpiredSessions_skipped_whenDisabled() {
        ReflectionTestUtils.setField(job, "sweepEnabled", false);

        job.abandonExpiredSessions();

        verify(sessionService, never()).sweepExpiredSessions();
    }
}
