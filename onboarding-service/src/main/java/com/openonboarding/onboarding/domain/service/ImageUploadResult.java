package com.openonboarding.onboarding.domain.service;

import com.openonboarding.onboarding.domain.image.AnalyzedImage;

import java.util.List;

public record ImageUploadResult(List<AnalyzedImage> images, StepUpdateResult update) {

    public ImageUploadResult {
        images = images == null ? List.of() : List.copyOf(images);
    }
}
