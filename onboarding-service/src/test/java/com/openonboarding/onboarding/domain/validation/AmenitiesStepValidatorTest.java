package com.openonboarding.onboarding.domain.validation;

import com.openonboarding.onboarding.domain.amenity.AmenityRuleValidator;
import com.openonboarding.onboarding.domain.amenity.PropertyType;
import com.openonboarding.onboarding.domain.model.AmenitiesPayload;
import com.openonboarding.onboarding.support.OnboardingFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class AmenitiesStepValidatorTest {

    private final AmenitiesStepValidator validator = new AmenitiesStepValidator(new AmenityRuleValidator());
    private final ValidationContext context = ValidationContext.standalone(OnboardingFixtures.catalog());

    @Test
    @DisplayName("Valid selection passes")
    void validate_success() {
        ValidationResult result = validator.validate(
                OnboardingFixtures.amenities(PropertyType.HOTEL, "wifi", "parking"), context);

        assertThat(result.isValid()).isTrue();
        assertThat(result.errors()).isEmpty();
    }

    @Test
    @DisplayName("Property type and at least one amenity are required")
    void validate_errors_whenEmpty() {
        ValidationResult result = validator.validate(new AmenitiesPayload(null, Set.of()), context);

        assertThat(result.errors()).containsExactly(
                "Property type is required",
                "At least one amenity must be selected");
        assertThat(result.warnings()).containsExactly("No amenities selected");
    }

    @Test
    @DisplayName("Catalog rule violations are included")
    void validate_includesRuleErrors() {
        ValidationResult result = validator.validate(
                OnboardingFixtures.amenities(PropertyType.HOTEL, "ev-charging"), context);

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).containsExactly("EV charging station requires Parking to be selected");
    }
}
