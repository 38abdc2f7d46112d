package com.openonboarding.onboarding.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Wizard steps. The wire id is the kebab-case name used in URLs and stored drafts.
 */
public enum StepId {
    AMENITIES("amenities"),
    IMAGES("images"),
    PROPERTY_INFO("property-info"),
    ROOMS("rooms"),
    BUSINESS_FEATURES("business-features");

    private final String wireId;

    StepId(String wireId) {
        this.wireId = wireId;
    }

    @JsonValue
    public String wireId() {
        return wireId;
    }

    public static Optional<StepId> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(step -> step.wireId.equalsIgnoreCase(value) || step.name().equalsIgnoreCase(value))
                .findFirst();
    }

    @JsonCreator
    public static StepId fromWireId(String value) {
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown onboarding step: " + value));
    }
}
