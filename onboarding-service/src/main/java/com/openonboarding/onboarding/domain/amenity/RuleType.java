package com.openonboarding.onboarding.domain.amenity;

/**
 * Relationship from one amenity to another.
 * REQUIRES and EXCLUDES violations are errors; a missing IMPLIES target is only a warning.
 */
public enum RuleType {
    REQUIRES,
    EXCLUDES,
    IMPLIES
}
