package com.openonboarding.onboarding.domain.amenity;

import com.openonboarding.onboarding.domain.validation.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Checks an amenity selection against the catalog's business rules.
 *
 * Every selected amenity is evaluated independently, so a conflict declared on both amenities of an
 * {@code excludes} pair is reported twice. The catalog is never modified.
 */
@Component
public class AmenityRuleValidator {

    static final String NO_AMENITIES = "No amenities selected";

    public ValidationResult validate(Set<String> selection, PropertyType propertyType,
                                     AmenityCatalogSnapshot catalog) {
        if (selection == null || selection.isEmpty()) {
            return ValidationResult.builder().warning(NO_AMENITIES).build();
        }

        ValidationResult.ValidationResultBuilder result = ValidationResult.builder();

        List<String> unknown = selection.stream().filter(id -> !catalog.contains(id)).toList();
        if (!unknown.isEmpty()) {
            result.error("Unknown amenities: " + String.join(", ", unknown));
        }

        Set<AmenityCategory> coveredCategories = EnumSet.noneOf(AmenityCategory.class);
        for (String amenityId : selection) {
            AmenityDefinition amenity = catalog.find(amenityId).orElse(null);
            if (amenity == null) {
                continue;
            }
            if (amenity.category() != null) {
                coveredCategories.add(amenity.category());
            }

            if (propertyType != null && !amenity.isApplicableTo(propertyType)) {
                result.error(String.format("%s is not available for %s properties",
                        amenity.displayName(), propertyType.displayName()));
            }

            for (AmenityRule rule : amenity.businessRules()) {
                String target = catalog.displayName(rule.amenityId());
                boolean targetSelected = selection.contains(rule.amenityId());
                switch (rule.type()) {
                    case REQUIRES -> {
                        if (!targetSelected) {
                            result.error(String.format("%s requires %s to be selected", amenity.displayName(), target));
                        }
                    }
                    case EXCLUDES -> {
                        if (targetSelected) {
                            result.error(String.format("%s cannot be selected together with %s",
                                    amenity.displayName(), target));
                        }
                    }
                    case IMPLIES -> {
                        if (!targetSelected) {
                            result.warning(String.format("%s usually comes with %s; consider selecting it",
                                    amenity.displayName(), target));
                        }
                    }
                }
            }
        }

        if (propertyType != null) {
            for (AmenityCategory required : catalog.requiredCategories(propertyType)) {
                if (!coveredCategories.contains(required)) {
                    result.warning(String.format("Guests of %s properties expect %s amenities",
                            propertyType.displayName(), required.displayName()));
                }
            }
        }

        return result.build();
    }
}
