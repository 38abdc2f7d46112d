package com.openonboarding.onboarding.domain.model;

import java.util.List;

public record LocationDetails(
        List<String> nearbyAttractions,
        List<String> transportation,
        List<String> accessibility,
        String neighborhood
) {
    public LocationDetails {
        nearbyAttractions = nearbyAttractions == null ? List.of() : List.copyOf(nearbyAttractions);
        transportation = transportation == null ? List.of() : List.copyOf(transportation);
        accessibility = accessibility == null ? List.of() : List.copyOf(accessibility);
    }
}
