package com.openonboarding.onboarding.domain.validation;

import com.openonboarding.onboarding.domain.amenity.AmenityCatalog;
import com.openonboarding.onboarding.domain.model.StepId;
import com.openonboarding.onboarding.domain.model.StepPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches a payload to the validator registered for its step.
 */
@Slf4j
@Service
public class StepValidationService {

    private final Map<StepId, StepValidator<?>> validators = new EnumMap<>(StepId.class);
    private final AmenityCatalog amenityCatalog;

    public StepValidationService(List<StepValidator<?>> stepValidators, AmenityCatalog amenityCatalog) {
        this.amenityCatalog = amenityCatalog;
        for (StepValidator<?> validator : stepValidators) {
            if (validators.putIfAbsent(validator.stepId(), validator) != null) {
                throw new IllegalStateException("Duplicate validator for step " + validator.stepId());
            }
        }
        log.info("Registered step validators for {}", validators.keySet());
    }

    public ValidationResult validate(StepId stepId, StepPayload payload) {
        return validate(stepId, payload, false, Map.of());
    }

    public ValidationResult validate(StepId stepId, StepPayload payload, boolean validateDependencies,
                                     Map<StepId, StepPayload> draftSnapshot) {
        if (payload == null) {
            return ValidationResult.builder().error("Payload for step " + stepId.wireId() + " is required").build();
        }
        if (payload.stepId() != stepId) {
            return ValidationResult.builder()
                    .error("Payload for step " + payload.stepId().wireId() + " cannot be submitted as " + stepId.wireId())
                    .build();
        }
        StepValidator<?> validator = validators.get(stepId);
        if (validator == null) {
            throw new IllegalStateException("No validator registered for step " + stepId);
        }
        ValidationContext context = new ValidationContext(
                amenityCatalog.snapshot(), validateDependencies, draftSnapshot);
        return dispatch(validator, payload, context);
    }

    private static <P extends StepPayload> ValidationResult dispatch(StepValidator<P> validator, StepPayload payload,
                                                                     ValidationContext context) {
        return validator.validate(validator.payloadType().cast(payload), context);
    }
}
