package com.openonboarding.onboarding.api.dto;

import com.openonboarding.onboarding.domain.image.AnalyzedImage;
import com.openonboarding.onboarding.domain.image.QualityCheckResult;
import com.openonboarding.onboarding.domain.model.ImageRecord;
import com.openonboarding.onboarding.domain.service.ImageUploadResult;
import com.openonboarding.onboarding.domain.service.StepUpdateResult;

import java.util.List;

public record ImageUploadResponse(List<AnalyzedImageResponse> images, StepUpdateResult update) {

    public static ImageUploadResponse from(ImageUploadResult result) {
        List<AnalyzedImageResponse> images = result.images().stream()
                .map(ImageUploadResponse::toResponse)
                .toList();
        return new ImageUploadResponse(images, result.update());
    }

    public record AnalyzedImageResponse(ImageRecord image, QualityCheckResult analysis) {
    }

    private static AnalyzedImageResponse toResponse(AnalyzedImage analyzed) {
        return new AnalyzedImageResponse(analyzed.toRecord(), analyzed.result());
    }
}
