package com.openonboarding.onboarding.domain.amenity;

import java.util.List;
import java.util.Set;

/**
 * Catalog entry for one amenity. An empty {@code applicablePropertyTypes} set means the amenity fits every
 * property type.
 */
public record AmenityDefinition(
        String id,
        String name,
        String description,
        AmenityCategory category,
        boolean ecoFriendly,
        Set<PropertyType> applicablePropertyTypes,
        List<AmenityRule> businessRules
) {
    public AmenityDefinition {
        applicablePropertyTypes = applicablePropertyTypes == null ? Set.of() : Set.copyOf(applicablePropertyTypes);
        businessRules = businessRules == null ? List.of() : List.copyOf(businessRules);
    }

    public boolean isApplicableTo(PropertyType propertyType) {
        return applicablePropertyTypes.isEmpty() || applicablePropertyTypes.contains(propertyType);
    }

    public String displayName() {
        return name == null || name.isBlank() ? id : name;
    }
}
