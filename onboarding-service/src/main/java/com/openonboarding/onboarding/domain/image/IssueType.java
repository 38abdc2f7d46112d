package com.openonboarding.onboarding.domain.image;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IssueType {
    RESOLUTION,
    ASPECT_RATIO,
    BRIGHTNESS,
    CONTRAST,
    BLUR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
