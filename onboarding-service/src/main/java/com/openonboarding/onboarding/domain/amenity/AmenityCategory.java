package com.openonboarding.onboarding.domain.amenity;

import java.util.Locale;

public enum AmenityCategory {
    PROPERTY_WIDE,
    ROOM_SPECIFIC,
    BUSINESS,
    WELLNESS,
    DINING,
    SUSTAINABILITY,
    RECREATIONAL,
    CONNECTIVITY;

    public String displayName() {
        return name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }
}
