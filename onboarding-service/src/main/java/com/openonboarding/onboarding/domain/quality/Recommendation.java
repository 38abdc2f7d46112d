package com.openonboarding.onboarding.domain.quality;

/**
 * @param estimatedImpact overall-score points the listing would gain by reaching the good threshold
 * @param factor          name of the factor that triggered the recommendation
 */
public record Recommendation(
        RecommendationType type,
        RecommendationPriority priority,
        String title,
        String actionRequired,
        int estimatedImpact,
        String factor
) {
}
