package com.openonboarding.onboarding.domain.model;

import com.openonboarding.onboarding.domain.amenity.PropertyType;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public record AmenitiesPayload(PropertyType propertyType, Set<String> selectedAmenities) implements StepPayload {

    public AmenitiesPayload {
        selectedAmenities = selectedAmenities == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(selectedAmenities));
    }

    @Override
    public StepId stepId() {
        return StepId.AMENITIES;
    }
}
