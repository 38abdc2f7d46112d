package com.openonboarding.onboarding.domain.validation;

import com.openonboarding.onboarding.domain.model.BusinessFeaturesPayload;
import com.openonboarding.onboarding.domain.model.StepId;
import org.springframework.stereotype.Component;

/**
 * The step is optional, so an empty payload is valid. Data that is provided must still be well formed.
 */
@Component
public class BusinessFeaturesStepValidator implements StepValidator<BusinessFeaturesPayload> {

    @Override
    public StepId stepId() {
        return StepId.BUSINESS_FEATURES;
    }

    @Override
    public Class<BusinessFeaturesPayload> payloadType() {
        return BusinessFeaturesPayload.class;
    }

    @Override
    public ValidationResult validate(BusinessFeaturesPayload payload, ValidationContext context) {
        if (payload.isEmpty()) {
            return ValidationResult.valid();
        }
        ValidationResult.ValidationResultBuilder result = ValidationResult.builder();

        boolean malformedMeetingRoom = payload.meetingRooms().stream()
                .anyMatch(room -> room == null || isBlank(room.name()) || room.capacity() == null || room.capacity() < 1);
        if (malformedMeetingRoom) {
            result.error("Meeting rooms must have name and capacity");
        }

        boolean malformedWorkSpace = payload.workSpaces().stream()
                .anyMatch(space -> space == null || isBlank(space.name()));
        if (malformedWorkSpace) {
            result.error("Work spaces must have a name");
        }

        if (payload.connectivity() == null || payload.connectivity().wifiSpeed() == null) {
            result.warning("Consider providing WiFi speed information for business travelers");
        }
        return result.build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
