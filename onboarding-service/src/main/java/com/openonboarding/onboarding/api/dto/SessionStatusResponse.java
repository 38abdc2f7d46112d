package com.openonboarding.onboarding.api.dto;

import com.openonboarding.onboarding.domain.model.OnboardingSession;
import com.openonboarding.onboarding.domain.model.SessionStatus;
import com.openonboarding.onboarding.domain.model.StepPayload;
import com.openonboarding.onboarding.domain.quality.MissingInformation;
import com.openonboarding.onboarding.domain.quality.QualityScoreBreakdown;
import com.openonboarding.onboarding.domain.quality.Recommendation;
import com.openonboarding.onboarding.domain.service.SessionProgress;
import com.openonboarding.onboarding.domain.service.SessionStatusView;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record SessionStatusResponse(
        String sessionId,
        String hotelId,
        String ownerId,
        SessionStatus status,
        Map<String, StepPayload> draft,
        int qualityScore,
        QualityScoreBreakdown breakdown,
        List<MissingInformation> missingInformation,
        List<Recommendation> recommendations,
        SessionProgress progress,
        Instant createdAt,
        Instant updatedAt,
        Instant expiresAt
) {
    public static SessionStatusResponse from(SessionStatusView view) {
        OnboardingSession session = view.session();
        Map<String, StepPayload> draft = new LinkedHashMap<>();
        session.getDraft().forEach((stepId, payload) -> draft.put(stepId.wireId(), payload));
        return new SessionStatusResponse(
                session.getId(),
                session.getHotelId(),
                session.getOwnerId(),
                session.getStatus(),
                draft,
                session.getQualityScore(),
                view.assessment().breakdown(),
                view.assessment().missingInformation(),
                view.assessment().recommendations(),
                view.progress(),
                session.getCreatedAt(),
                session.getUpdatedAt(),
                session.getExpiresAt());
    }
}
