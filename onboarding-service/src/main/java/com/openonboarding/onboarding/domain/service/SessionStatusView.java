package com.openonboarding.onboarding.domain.service;

import com.openonboarding.onboarding.domain.model.OnboardingSession;
import com.openonboarding.onboarding.domain.quality.QualityAssessment;

/**
 * Everything the wizard needs to render a session: the session itself, its current assessment and the
 * step progress.
 */
public record SessionStatusView(OnboardingSession session, QualityAssessment assessment, SessionProgress progress) {
}
