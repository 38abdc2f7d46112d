package com.openonboarding.onboarding.domain.validation;

import com.openonboarding.onboarding.domain.amenity.AmenityRuleValidator;
import com.openonboarding.onboarding.domain.model.AmenitiesPayload;
import com.openonboarding.onboarding.domain.model.StepId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AmenitiesStepValidator implements StepValidator<AmenitiesPayload> {

    private final AmenityRuleValidator ruleValidator;

    @Override
    public StepId stepId() {
        return StepId.AMENITIES;
    }

    @Override
    public Class<AmenitiesPayload> payloadType() {
        return AmenitiesPayload.class;
    }

    @Override
    public ValidationResult validate(AmenitiesPayload payload, ValidationContext context) {
        ValidationResult.ValidationResultBuilder result = ValidationResult.builder();
        if (payload.propertyType() == null) {
            result.error("Property type is required");
        }
        if (payload.selectedAmenities().isEmpty()) {
            result.error("At least one amenity must be selected");
        }
        return result.build().merge(
                ruleValidator.validate(payload.selectedAmenities(), payload.propertyType(), context.catalog()));
    }
}
