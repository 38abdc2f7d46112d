package com.openonboarding.onboarding.domain.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Builder(toBuilder = true)
public record RoomRecord(
        String id,
        String name,
        Integer maxOccupancy,
        BigDecimal basePrice,
        Set<String> amenities,
        List<String> imageIds
) {
    public RoomRecord {
        amenities = amenities == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(amenities));
        imageIds = imageIds == null ? List.of() : List.copyOf(imageIds);
    }
}
