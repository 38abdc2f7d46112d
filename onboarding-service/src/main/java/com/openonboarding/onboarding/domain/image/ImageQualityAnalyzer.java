package com.openonboarding.onboarding.domain.image;

import com.openonboarding.onboarding.domain.model.ImageDimensions;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scores a single image against {@link ImageQualityStandards}.
 *
 * The score starts at 100 and each detected issue subtracts a fixed penalty; an image passes unless one
 * of its issues is of high severity. Any failure to read or measure the image degrades to
 * {@link QualityCheckResult#failure()} instead of throwing. Instances hold no mutable state and are
 * safe to share between threads.
 */
@Slf4j
public class ImageQualityAnalyzer {

    static final int MISSING_DIMENSIONS_PENALTY = 30;
    static final int LOW_RESOLUTION_PENALTY = 20;
    static final int ASPECT_RATIO_PENALTY = 10;
    static final int BRIGHTNESS_PENALTY = 15;
    static final int CONTRAST_PENALTY = 15;
    static final int BLUR_PENALTY = 25;

    static final String ALL_GOOD = "Image meets all quality standards";

    private final ImageQualityStandards standards;
    private final ImageDecoder decoder;

    public ImageQualityAnalyzer(ImageQualityStandards standards, ImageDecoder decoder) {
        this.standards = standards;
        this.decoder = decoder;
    }

    public ImageQualityStandards getStandards() {
        return standards;
    }

    /**
     * Decodes the bytes and analyzes the result.
     */
    public QualityCheckResult analyze(byte[] content) {
        try {
            return evaluate(decoder.decode(content));
        } catch (RuntimeException e) {
            log.warn("Image analysis failed, returning failing result: {}", e.getMessage());
            return QualityCheckResult.failure();
        }
    }

    public QualityCheckResult analyze(ImageStatistics statistics) {
        try {
            return evaluate(statistics);
        } catch (RuntimeException e) {
            log.warn("Image analysis failed, returning failing result: {}", e.getMessage());
            return QualityCheckResult.failure();
        }
    }

    public boolean isHighQuality(int score) {
        return score >= standards.highQualityThreshold();
    }

    private QualityCheckResult evaluate(ImageStatistics statistics) {
        if (statistics == null) {
            throw new ImageAnalysisException("No image statistics");
        }
        List<QualityIssue> issues = new ArrayList<>();
        int penalty = 0;

        boolean measured = statistics.hasDimensions();
        if (!measured) {
            issues.add(new QualityIssue(IssueType.RESOLUTION, IssueSeverity.HIGH,
                    "Unable to determine image dimensions", "Upload a higher resolution image"));
            penalty += MISSING_DIMENSIONS_PENALTY;
        } else {
            int width = statistics.width();
            int height = statistics.height();
            if (width < standards.minWidth() || height < standards.minHeight()) {
                issues.add(new QualityIssue(IssueType.RESOLUTION, IssueSeverity.MEDIUM,
                        String.format("Image resolution %dx%d is below the recommended %dx%d",
                                width, height, standards.minWidth(), standards.minHeight()),
                        "Upload a higher resolution image"));
                penalty += LOW_RESOLUTION_PENALTY;
            }

            double aspectRatio = (double) width / height;
            if (!isStandardAspectRatio(aspectRatio)) {
                issues.add(new QualityIssue(IssueType.ASPECT_RATIO, IssueSeverity.LOW,
                        String.format(Locale.ROOT, "Unusual aspect ratio %.2f", aspectRatio),
                        "Consider cropping to standard aspect ratios like 16:9 or 4:3"));
                penalty += ASPECT_RATIO_PENALTY;
            }
        }

        double brightness = average(statistics.channelMeans(), "channel means");
        if (brightness < standards.minBrightness()) {
            issues.add(new QualityIssue(IssueType.BRIGHTNESS, IssueSeverity.MEDIUM,
                    "Image appears too dark",
                    "Increase brightness or improve lighting when taking the photo"));
            penalty += BRIGHTNESS_PENALTY;
        } else if (brightness > standards.maxBrightness()) {
            issues.add(new QualityIssue(IssueType.BRIGHTNESS, IssueSeverity.MEDIUM,
                    "Image appears overexposed",
                    "Reduce brightness or avoid harsh lighting"));
            penalty += BRIGHTNESS_PENALTY;
        }

        double contrast = average(statistics.channelStdevs(), "channel standard deviations");
        if (contrast < standards.minContrast()) {
            issues.add(new QualityIssue(IssueType.CONTRAST, IssueSeverity.MEDIUM,
                    "Image has low contrast",
                    "Increase contrast or ensure better lighting conditions"));
            penalty += CONTRAST_PENALTY;
        }

        if (measured) {
            double blurScore = blurScore(statistics.width(), statistics.height(), statistics.grayscale());
            if (blurScore < standards.blurThreshold()) {
                issues.add(new QualityIssue(IssueType.BLUR, IssueSeverity.HIGH,
                        "Image appears blurry or out of focus",
                        "Ensure camera is focused and stable when taking the photo"));
                penalty += BLUR_PENALTY;
            }
        }

        int score = Math.max(0, 100 - penalty);
        boolean passed = issues.stream().noneMatch(issue -> issue.severity() == IssueSeverity.HIGH);
        List<String> recommendations = issues.isEmpty()
                ? List.of(ALL_GOOD)
                : issues.stream().map(QualityIssue::suggestedFix).toList();
        ImageDimensions dimensions = measured
                ? new ImageDimensions(statistics.width(), statistics.height())
                : null;

        return new QualityCheckResult(passed, score, issues, recommendations, dimensions);
    }

    private boolean isStandardAspectRatio(double aspectRatio) {
        for (double standard : standards.aspectRatios()) {
            if (Math.abs(aspectRatio - standard) <= standards.aspectRatioTolerance()) {
                return true;
            }
        }
        return false;
    }

    private static double average(double[] values, String what) {
        if (values == null || values.length == 0) {
            throw new ImageAnalysisException("Missing " + what);
        }
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * Mean squared response of the 3x3 Laplacian over the interior pixels. Images smaller than 3x3 have
     * no interior and score 0.
     */
    static double blurScore(int width, int height, byte[] grayscale) {
        if (grayscale == null || grayscale.length != width * height) {
            throw new ImageAnalysisException("Grayscale buffer does not match image dimensions");
        }
        if (width < 3 || height < 3) {
            return 0.0;
        }

        double sumOfSquares = 0;
        for (int y = 1; y < height - 1; y++) {
            int rowAbove = (y - 1) * width;
            int row = y * width;
            int rowBelow = (y + 1) * width;
            for (int x = 1; x < width - 1; x++) {
                int neighbours = pixel(grayscale, rowAbove + x - 1) + pixel(grayscale, rowAbove + x)
                        + pixel(grayscale, rowAbove + x + 1)
                        + pixel(grayscale, row + x - 1) + pixel(grayscale, row + x + 1)
                        + pixel(grayscale, rowBelow + x - 1) + pixel(grayscale, rowBelow + x)
                        + pixel(grayscale, rowBelow + x + 1);
                int laplacian = 8 * pixel(grayscale, row + x) - neighbours;
                sumOfSquares += (double) laplacian * laplacian;
            }
        }
        return sumOfSquares / ((double) (width - 2) * (height - 2));
    }

    private static int pixel(byte[] grayscale, int index) {
        return grayscale[index] & 0xFF;
    }
}
