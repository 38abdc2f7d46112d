package com.openonboarding.onboarding.domain.validation;

import com.openonboarding.onboarding.domain.model.BusinessFeaturesPayload;
import com.openonboarding.onboarding.support.OnboardingFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BusinessFeaturesStepValidatorTest {

    private final BusinessFeaturesStepValidator validator = new BusinessFeaturesStepValidator();
    private final ValidationContext context = ValidationContext.standalone(OnboardingFixtures.catalog());

    @Test
    @DisplayName("Empty payload is valid without warnings")
    void validate_emptyPayloadIsValid() {
        ValidationResult result = validator.validate(new BusinessFeaturesPayload(null, null, null, null), context);

        assertThat(result.isValid()).isTrue();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    @DisplayName("Well formed features pass; missing WiFi speed warns")
    void validate_warning_whenWifiSpeedMissing() {
        BusinessFeaturesPayload payload = new BusinessFeaturesPayload(
                List.of(new BusinessFeaturesPayload.MeetingRoom("m1", "Boardroom", 12)),
                null,
                List.of(new BusinessFeaturesPayload.WorkSpace("w1", "Cowork lounge", 20)),
                List.of("printing"));

        ValidationResult result = validator.validate(payload, context);

        assertThat(result.isValid()).isTrue();
        assertThat(result.warnings())
                .containsExactly("Consider providing WiFi speed information for business travelers");
    }

    @Test
    @DisplayName("Malformed meeting rooms and work spaces are errors")
    void validate_errors_whenMalformed() {
        BusinessFeaturesPayload payload = new BusinessFeaturesPayload(
                List.of(new BusinessFeaturesPayload.MeetingRoom("m1", "Boardroom", null)),
                new BusinessFeaturesPayload.Connectivity(new BusinessFeaturesPayload.WifiSpeed(100, 50, 10)),
                List.of(new BusinessFeaturesPayload.WorkSpace("w1", " ", 4)),
                null);

        ValidationResult result = validator.validate(payload, context);

        assertThat(result.errors()).containsExactly(
                "Meeting rooms must have name and capacity",
                "Work spaces must have a name");
        assertThat(result.warnings()).isEmpty();
    }
}
