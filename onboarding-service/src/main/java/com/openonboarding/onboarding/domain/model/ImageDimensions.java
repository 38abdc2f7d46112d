package com.openonboarding.onboarding.domain.model;

public record ImageDimensions(int width, int height) {

    public boolean atLeast(int minWidth, int minHeight) {
        return width >= minWidth && height >= minHeight;
    }
}
