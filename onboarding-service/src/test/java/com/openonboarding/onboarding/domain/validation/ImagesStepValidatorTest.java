package com.openonboarding.onboarding.domain.validation;

import com.openonboarding.onboarding.domain.image.IssueSeverity;
import com.openonboarding.onboarding.domain.image.IssueType;
import com.openonboarding.onboarding.domain.image.QualityIssue;
import com.openonboarding.onboarding.domain.model.ImageCategory;
import com.openonboarding.onboarding.domain.model.ImageRecord;
import com.openonboarding.onboarding.domain.model.ImagesPayload;
import com.openonboarding.onboarding.support.OnboardingFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.openonboarding.onboarding.support.OnboardingFixtures.image;
import static org.assertj.core.api.Assertions.assertThat;

class ImagesStepValidatorTest {

    private final ImagesStepValidator validator = new ImagesStepValidator();
    private final ValidationContext context = ValidationContext.standalone(OnboardingFixtures.catalog());

    @Test
    @DisplayName("Gallery covering the essential categories is clean")
    void validate_success() {
        ValidationResult result = validator.validate(OnboardingFixtures.fullImages(), context);

        assertThat(result.isValid()).isTrue();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    @DisplayName("Empty gallery is rejected")
    void validate_error_whenNoImages() {
        ValidationResult result = validator.validate(new ImagesPayload(List.of()), context);

        assertThat(result.errors()).containsExactly("At least one image is required");
    }

    @Test
    @DisplayName("Images need an id, a url and a score within 0-100")
    void validate_errors_whenImageMalformed() {
        // given
        ImageRecord noId = image("x", ImageCategory.EXTERIOR, 90).toBuilder().id(null).build();
        ImageRecord noUrl = image("lobby", ImageCategory.LOBBY, 90).toBuilder().url(" ").build();
        ImageRecord badScore = image("room", ImageCategory.ROOMS, 150);

        // when
        ValidationResult result = validator.validate(OnboardingFixtures.images(noId, noUrl, badScore), context);

        // then
        assertThat(result.errors()).containsExactly(
                "Image at position 1 must have an id",
                "Image lobby must have a url",
                "Image room has a quality score outside 0-100");
    }

    @Test
    @DisplayName("Unanalyzed, failed and missing essential categories only warn")
    void validate_warnings() {
        // given
        ImageRecord unanalyzed = image("pool", ImageCategory.RECREATIONAL, 90).toBuilder().qualityScore(null).build();
        ImageRecord blurry = image("room", ImageCategory.ROOMS, 75).toBuilder()
                .issues(List.of(new QualityIssue(IssueType.BLUR, IssueSeverity.HIGH,
                        "Image appears blurry or out of focus", "Hold the camera steady")))
                .build();

        // when
        ValidationResult result = validator.validate(OnboardingFixtures.images(unanalyzed, blurry), context);

        // then
        assertThat(result.isValid()).isTrue();
        assertThat(result.warnings()).containsExactly(
                "Image pool has not been analyzed for quality",
                "Image room did not pass quality checks: Image appears blurry or out of focus",
                "Add at least one exterior image",
                "Add at least one lobby image");
    }
}
