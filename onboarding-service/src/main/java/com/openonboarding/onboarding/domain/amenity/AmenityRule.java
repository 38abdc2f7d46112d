package com.openonboarding.onboarding.domain.amenity;

/**
 * @param condition free-text note shown to operators, never evaluated
 */
public record AmenityRule(RuleType type, String amenityId, String condition) {
}
