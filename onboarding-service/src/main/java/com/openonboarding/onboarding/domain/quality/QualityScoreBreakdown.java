package com.openonboarding.onboarding.domain.quality;

public record QualityScoreBreakdown(
        ComponentScore imageQuality,
        ComponentScore contentCompleteness,
        ComponentScore policyClarity,
        int overall
) {
}
