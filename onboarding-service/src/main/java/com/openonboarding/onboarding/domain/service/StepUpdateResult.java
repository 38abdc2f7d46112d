package com.openonboarding.onboarding.domain.service;

import com.openonboarding.onboarding.domain.model.StepId;
import com.openonboarding.onboarding.domain.quality.QualityScoreBreakdown;

import java.util.List;

/**
 * @param changed false when the submission matched what was already stored
 */
public record StepUpdateResult(
        StepId stepId,
        int qualityScore,
        QualityScoreBreakdown breakdown,
        List<String> warnings,
        boolean changed
) {
    public StepUpdateResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
