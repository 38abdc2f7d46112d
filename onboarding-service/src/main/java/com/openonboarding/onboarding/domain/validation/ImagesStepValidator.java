package com.openonboarding.onboarding.domain.validation;

import com.openonboarding.onboarding.domain.image.QualityIssue;
import com.openonboarding.onboarding.domain.model.ImageCategory;
import com.openonboarding.onboarding.domain.model.ImageRecord;
import com.openonboarding.onboarding.domain.model.ImagesPayload;
import com.openonboarding.onboarding.domain.model.StepId;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the scores and issues captured at upload time; images are never re-analyzed here.
 */
@Component
public class ImagesStepValidator implements StepValidator<ImagesPayload> {

    @Override
    public StepId stepId() {
        return StepId.IMAGES;
    }

    @Override
    public Class<ImagesPayload> payloadType() {
        return ImagesPayload.class;
    }

    @Override
    public ValidationResult validate(ImagesPayload payload, ValidationContext context) {
        List<ImageRecord> images = payload.images();
        ValidationResult.ValidationResultBuilder result = ValidationResult.builder();
        if (images.isEmpty()) {
            return result.error("At least one image is required").build();
        }

        Set<ImageCategory> covered = EnumSet.noneOf(ImageCategory.class);
        for (int i = 0; i < images.size(); i++) {
            ImageRecord image = images.get(i);
            String label = isBlank(image.id()) ? "at position " + (i + 1) : image.id();
            if (isBlank(image.id())) {
                result.error("Image " + label + " must have an id");
            }
            if (isBlank(image.url())) {
                result.error("Image " + label + " must have a url");
            }
            if (image.category() != null) {
                covered.add(image.category());
            }

            Integer score = image.qualityScore();
            if (score == null) {
                result.warning("Image " + label + " has not been analyzed for quality");
            } else if (score < 0 || score > 100) {
                result.error("Image " + label + " has a quality score outside 0-100");
            } else if (!image.passedAnalysis()) {
                String problems = image.issues().stream()
                        .map(QualityIssue::description)
                        .collect(Collectors.joining("; "));
                result.warning("Image " + label + " did not pass quality checks: " + problems);
            }
        }

        for (ImageCategory essential : ImageCategory.ESSENTIAL) {
            if (!covered.contains(essential)) {
                result.warning("Add at least one " + essential.name().toLowerCase(Locale.ROOT) + " image");
            }
        }
        return result.build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
