package com.openonboarding.onboarding.domain.validation;

import com.openonboarding.onboarding.domain.model.StepId;
import com.openonboarding.onboarding.domain.model.StepPayload;

/**
 * Structural and business checks for one wizard step. Implementations are pure: they read the payload
 * and context and never mutate either.
 *
 * @param <P> payload type of the step
 */
public interface StepValidator<P extends StepPayload> {

    StepId stepId();

    Class<P> payloadType();

    ValidationResult validate(P payload, ValidationContext context);
}
