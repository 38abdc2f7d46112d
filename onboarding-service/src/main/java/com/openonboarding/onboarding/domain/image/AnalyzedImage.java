package com.openonboarding.onboarding.domain.image;

import com.openonboarding.onboarding.domain.model.ImageRecord;

/**
 * An upload paired with its analysis, ready to be stored as an {@link ImageRecord}.
 */
public record AnalyzedImage(ImageUpload upload, QualityCheckResult result) {

    public ImageRecord toRecord() {
        return ImageRecord.builder()
                .id(upload.id())
                .category(upload.category())
                .url(upload.url())
                .qualityScore(result.score())
                .dimensions(result.dimensions())
                .issues(result.issues())
                .tags(upload.tags())
                .build();
    }
}
