package com.openonboarding.onboarding.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Published once when a session is completed. Downstream services use it to publish the listing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OnboardingCompletedEvent {
    private String sessionId;
    private String hotelId;
    private String ownerId;
    private int qualityScore;
    private List<String> completedSteps;
    private Instant timestamp;
}
