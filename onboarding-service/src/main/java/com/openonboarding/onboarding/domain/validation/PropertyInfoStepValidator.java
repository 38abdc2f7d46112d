package com.openonboarding.onboarding.domain.validation;

import com.openonboarding.onboarding.config.OnboardingProperties;
import com.openonboarding.onboarding.domain.model.HotelPolicies;
import com.openonboarding.onboarding.domain.model.PropertyInfoPayload;
import com.openonboarding.onboarding.domain.model.StepId;
import org.springframework.stereotype.Component;

/**
 * A missing description or policy block is an error. A short description and thin policies only warn.
 */
@Component
public class PropertyInfoStepValidator implements StepValidator<PropertyInfoPayload> {

    private final int descriptionMinLength;

    public PropertyInfoStepValidator(OnboardingProperties properties) {
        this.descriptionMinLength = properties.getValidation().getDescriptionMinLength();
    }

    @Override
    public StepId stepId() {
        return StepId.PROPERTY_INFO;
    }

    @Override
    public Class<PropertyInfoPayload> payloadType() {
        return PropertyInfoPayload.class;
    }

    @Override
    public ValidationResult validate(PropertyInfoPayload payload, ValidationContext context) {
        ValidationResult.ValidationResultBuilder result = ValidationResult.builder();

        String description = payload.description();
        if (description == null || description.isBlank()) {
            result.error("Property description is required");
        } else if (description.trim().length() < descriptionMinLength) {
            result.warning("Property description should be at least " + descriptionMinLength + " characters");
        }

        HotelPolicies policies = payload.policies();
        if (policies == null) {
            result.error("Hotel policies are required");
        } else {
            if (policies.checkIn() == null || policies.checkIn().standardTime() == null) {
                result.warning("Check-in time is not specified");
            }
            if (policies.checkOut() == null || policies.checkOut().standardTime() == null) {
                result.warning("Check-out time is not specified");
            }
            if (policies.cancellation() == null) {
                result.warning("Cancellation policy is not specified");
            }
        }

        if (payload.locationDetails() == null) {
            result.warning("Location details help guests find the property; consider adding them");
        }
        return result.build();
    }
}
