package com.openonboarding.onboarding.domain.model;

import java.util.List;

public record ImagesPayload(List<ImageRecord> images) implements StepPayload {

    public ImagesPayload {
        images = images == null ? List.of() : List.copyOf(images);
    }

    @Override
    public StepId stepId() {
        return StepId.IMAGES;
    }
}
