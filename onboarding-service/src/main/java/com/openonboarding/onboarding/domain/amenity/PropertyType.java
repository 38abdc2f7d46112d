package com.openonboarding.onboarding.domain.amenity;

import java.util.Locale;

public enum PropertyType {
    HOTEL,
    RESORT,
    GUEST_HOUSE,
    HOMESTAY,
    APARTMENT,
    BOUTIQUE_HOTEL,
    BUSINESS_HOTEL,
    LUXURY_HOTEL;

    public String displayName() {
        return name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }
}
