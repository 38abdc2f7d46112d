package com.openonboarding.onboarding.domain.quality;

import java.util.List;

public record QualityAssessment(
        QualityScoreBreakdown breakdown,
        List<Recommendation> recommendations,
        List<MissingInformation> missingInformation
) {
    public QualityAssessment {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        missingInformation = missingInformation == null ? List.of() : List.copyOf(missingInformation);
    }

    public int overall() {
        return breakdown.overall();
    }
}
