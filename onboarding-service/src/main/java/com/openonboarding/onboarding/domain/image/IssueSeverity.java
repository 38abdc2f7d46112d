package com.openonboarding.onboarding.domain.image;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IssueSeverity {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
