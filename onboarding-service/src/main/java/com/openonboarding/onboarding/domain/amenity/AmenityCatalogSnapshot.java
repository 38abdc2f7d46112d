package com.openonboarding.onboarding.domain.amenity;

import java.util.Collections;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable view of the amenity catalog. Safe to share between sessions and threads without locking.
 */
public final class AmenityCatalogSnapshot {

    private final Map<String, AmenityDefinition> amenitiesById;
    private final Map<PropertyType, Set<AmenityCategory>> requiredCategories;

    public AmenityCatalogSnapshot(List<AmenityDefinition> amenities,
                                  Map<PropertyType, Set<AmenityCategory>> requiredCategories) {
        Map<String, AmenityDefinition> byId = new LinkedHashMap<>();
        for (AmenityDefinition amenity : amenities) {
            if (byId.putIfAbsent(amenity.id(), amenity) != null) {
                throw new IllegalArgumentException("Duplicate amenity id in catalog: " + amenity.id());
            }
        }
        this.amenitiesById = Collections.unmodifiableMap(byId);

        Map<PropertyType, Set<AmenityCategory>> required = new EnumMap<>(PropertyType.class);
        if (requiredCategories != null) {
            requiredCategories.forEach((type, categories) -> {
                EnumSet<AmenityCategory> copy = EnumSet.noneOf(AmenityCategory.class);
                copy.addAll(categories);
                required.put(type, Collections.unmodifiableSet(copy));
            });
        }
        this.requiredCategories = Collections.unmodifiableMap(required);
    }

    public static AmenityCatalogSnapshot of(List<AmenityDefinition> amenities) {
        return new AmenityCatalogSnapshot(amenities, Map.of());
    }

    public List<AmenityDefinition> amenities() {
        return List.copyOf(amenitiesById.values());
    }

    public Optional<AmenityDefinition> find(String amenityId) {
        return Optional.ofNullable(amenitiesById.get(amenityId));
    }

    public boolean contains(String amenityId) {
        return amenitiesById.containsKey(amenityId);
    }

    public String displayName(String amenityId) {
        return find(amenityId).map(AmenityDefinition::displayName).orElse(amenityId);
    }

    public Set<AmenityCategory> requiredCategories(PropertyType propertyType) {
        return requiredCategories.getOrDefault(propertyType, Set.of());
    }

    /**
     * Groups definitions by category, keeping catalog order inside each group.
     */
    public Map<AmenityCategory, List<AmenityDefinition>> byCategory() {
        Map<AmenityCategory, List<AmenityDefinition>> grouped = new EnumMap<>(AmenityCategory.class);
        for (AmenityDefinition amenity : amenitiesById.values()) {
            grouped.computeIfAbsent(amenity.category(), c -> new ArrayList<>()).add(amenity);
        }
        grouped.replaceAll((category, list) -> List.copyOf(list));
        return Collections.unmodifiableMap(grouped);
    }
}
