package com.openonboarding.onboarding.domain.quality;

public enum RecommendationType {
    IMAGE,
    CONTENT,
    POLICY,
    AMENITY
}
