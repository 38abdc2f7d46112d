package com.openonboarding.onboarding.domain.quality;

/**
 * Declared from most to least urgent; sorting by natural order puts HIGH first.
 */
public enum RecommendationPriority {
    HIGH,
    MEDIUM,
    LOW
}
