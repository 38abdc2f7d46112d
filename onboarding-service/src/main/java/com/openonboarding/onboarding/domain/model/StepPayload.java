package com.openonboarding.onboarding.domain.model;

/**
 * Typed data submitted for one wizard step. Each step has exactly one payload record.
 */
public interface StepPayload {

    StepId stepId();
}
