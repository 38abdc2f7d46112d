package com.openonboarding.onboarding.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * @param draft other steps keyed by step id, used only when {@code validateDependencies} is set
 */
public record ValidateStepRequest(
        JsonNode payload,
        boolean validateDependencies,
        Map<String, JsonNode> draft
) {
}
