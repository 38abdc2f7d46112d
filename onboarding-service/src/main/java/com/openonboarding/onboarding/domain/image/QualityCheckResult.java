package com.openonboarding.onboarding.domain.image;

import com.openonboarding.onboarding.domain.model.ImageDimensions;

import java.util.List;

/**
 * Outcome of analyzing one image. {@code dimensions} is null when the image could not be measured.
 */
public record QualityCheckResult(
        boolean passed,
        int score,
        List<QualityIssue> issues,
        List<String> recommendations,
        ImageDimensions dimensions
) {
    public static final String FAILURE_DESCRIPTION = "Failed to analyze image quality";

    public QualityCheckResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public static QualityCheckResult failure() {
        return new QualityCheckResult(
                false,
                0,
                List.of(new QualityIssue(IssueType.RESOLUTION, IssueSeverity.HIGH,
                        FAILURE_DESCRIPTION, "Upload a valid image file")),
                List.of("Upload a valid image file in a supported format"),
                null);
    }
}
