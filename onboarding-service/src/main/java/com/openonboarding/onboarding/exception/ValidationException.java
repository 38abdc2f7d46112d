package com.openonboarding.onboarding.exception;

import com.openonboarding.common.exception.BusinessException;
import com.openonboarding.onboarding.domain.model.StepId;
import com.openonboarding.onboarding.domain.validation.ValidationResult;
import lombok.Getter;

import java.util.List;

/**
 * A submission was rejected. Carries the full error and warning lists, or the steps still missing when a
 * session cannot be completed. Nothing is written when this is thrown.
 */
@Getter
public class ValidationException extends BusinessException {
    public static final String CODE = "VALIDATION_ERROR";

    private final List<String> errors;
    private final List<String> warnings;
    private final List<StepId> missingSteps;

    public ValidationException(ValidationResult result) {
        super("Validation failed: " + String.join("; ", result.errors()), CODE);
        this.errors = result.errors();
        this.warnings = result.warnings();
        this.missingSteps = List.of();
    }

    public ValidationException(String error) {
        this(ValidationResult.builder().error(error).build());
    }

    private ValidationException(List<StepId> missingSteps) {
        super("Required steps not completed: "
                + String.join(", ", missingSteps.stream().map(StepId::wireId).toList()), CODE);
        this.errors = missingSteps.stream().map(step -> "Step " + step.wireId() + " is not completed").toList();
        this.warnings = List.of();
        this.missingSteps = List.copyOf(missingSteps);
    }

    public static ValidationException missingSteps(List<StepId> missingSteps) {
        return new ValidationException(missingSteps);
    }
}
