package com.openonboarding.onboarding.domain.image;

import java.util.List;

/**
 * Thresholds applied by {@link ImageQualityAnalyzer}. Brightness and contrast are on a 0-255 scale.
 */
public record ImageQualityStandards(
        int minWidth,
        int minHeight,
        List<Double> aspectRatios,
        double aspectRatioTolerance,
        double minBrightness,
        double maxBrightness,
        double minContrast,
        double blurThreshold,
        int highQualityThreshold
) {
    public static final ImageQualityStandards DEFAULT = new ImageQualityStandards(
            1920,
            1080,
            List.of(16.0 / 9.0, 4.0 / 3.0, 3.0 / 2.0, 1.0),
            0.1,
            50.0,
            200.0,
            30.0,
            100.0,
            80);

    public ImageQualityStandards {
        aspectRatios = aspectRatios == null ? List.of() : List.copyOf(aspectRatios);
    }
}
