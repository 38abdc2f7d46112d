package com.openonboarding.onboarding.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Published when an expired session is marked ABANDONED.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OnboardingAbandonedEvent {
    private String sessionId;
    private String hotelId;
    private String ownerId;
    private List<String> completedSteps;
    private Instant expiredAt;
    private Instant timestamp;
}
