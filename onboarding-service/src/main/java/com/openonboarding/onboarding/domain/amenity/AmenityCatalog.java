package com.openonboarding.onboarding.domain.amenity;

import java.util.List;

/**
 * Read-only source of amenity reference data.
 */
public interface AmenityCatalog {

    AmenityCatalogSnapshot snapshot();

    default List<AmenityDefinition> listAmenities() {
        return snapshot().amenities();
    }
}
