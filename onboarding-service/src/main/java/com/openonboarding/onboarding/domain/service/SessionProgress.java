package com.openonboarding.onboarding.domain.service;

import com.openonboarding.onboarding.domain.model.StepId;

import java.util.List;

/**
 * @param completedRequired number of required steps already completed
 * @param missingSteps      required steps not yet completed, in wizard order
 */
public record SessionProgress(
        int completedRequired,
        int requiredSteps,
        int totalSteps,
        List<StepId> completedSteps,
        List<StepId> missingSteps
) {
    public SessionProgress {
        completedSteps = completedSteps == null ? List.of() : List.copyOf(completedSteps);
        missingSteps = missingSteps == null ? List.of() : List.copyOf(missingSteps);
    }

    public boolean readyToComplete() {
        return missingSteps.isEmpty();
    }
}
