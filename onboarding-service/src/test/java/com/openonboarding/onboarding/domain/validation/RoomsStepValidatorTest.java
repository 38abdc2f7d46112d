package com.openonboarding.onboarding.domain.validation;

import com.openonboarding.onboarding.domain.amenity.PropertyType;
import com.openonboarding.onboarding.domain.model.RoomRecord;
import com.openonboarding.onboarding.domain.model.RoomsPayload;
import com.openonboarding.onboarding.domain.model.StepId;
import com.openonboarding.onboarding.domain.model.StepPayload;
import com.openonboarding.onboarding.support.OnboardingFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.openonboarding.onboarding.support.OnboardingFixtures.room;
import static org.assertj.core.api.Assertions.assertThat;

class RoomsStepValidatorTest {

    private final RoomsStepValidator validator = new RoomsStepValidator();

    @Test
    @DisplayName("Empty room list is rejected")
    void validate_error_whenNoRooms() {
        ValidationResult result = validator.validate(new RoomsPayload(List.of()), standalone());

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).containsExactly("At least one room type is required");
    }

    @Test
    @DisplayName("Rooms need an id, a name, a positive occupancy and a non-negative price")
    void validate_errors_whenRoomMalformed() {
        // given
        RoomRecord broken = room("r1").toBuilder()
                .name("")
                .maxOccupancy(0)
                .basePrice(new BigDecimal("-1"))
                .build();

        // when
        ValidationResult result = validator.validate(OnboardingFixtures.rooms(broken), standalone());

        // then
        assertThat(result.errors()).containsExactly(
                "Room r1 must have a name",
                "Room r1 must allow at least one guest",
                "Room r1 must not have a negative base price");
    }

    @Test
    @DisplayName("Missing price and images only warn")
    void validate_warnings_whenPriceAndImagesMissing() {
        RoomRecord bare = room("r1").toBuilder().basePrice(null).imageIds(List.of()).build();

        ValidationResult result = validator.validate(OnboardingFixtures.rooms(bare), standalone());

        assertThat(result.isValid()).isTrue();
        assertThat(result.warnings()).containsExactly("Room r1 has no base price", "Room r1 has no images");
    }

    @Test
    @DisplayName("Dependency check compares rooms with the property amenities and gallery")
    void validate_dependencyWarnings() {
        // given
        RoomRecord suite = room("suite").toBuilder()
                .amenities(Set.of("spa"))
                .imageIds(List.of("img-missing"))
                .build();
        Map<StepId, StepPayload> draft = Map.of(
                StepId.AMENITIES, OnboardingFixtures.amenities(PropertyType.HOTEL, "wifi"),
                StepId.IMAGES, OnboardingFixtures.fullImages());
        ValidationContext context = new ValidationContext(OnboardingFixtures.catalog(), true, draft);

        // when
        ValidationResult result = validator.validate(OnboardingFixtures.rooms(suite), context);

        // then
        assertThat(result.isValid()).isTrue();
        assertThat(result.warnings()).containsExactly(
                "Room suite lists amenities not selected for the property: spa",
                "Room suite references images that were not uploaded: img-missing");
    }

    @Test
    @DisplayName("Dependency check is skipped unless requested")
    void validate_noDependencyWarnings_whenNotRequested() {
        RoomRecord suite = room("suite").toBuilder().amenities(Set.of("spa")).build();

        ValidationResult result = validator.validate(OnboardingFixtures.rooms(suite), standalone());

        assertThat(result.warnings()).isEmpty();
    }

    private static ValidationContext standalone() {
        return ValidationContext.standalone(OnboardingFixtures.catalog());
    }
}
