package com.openonboarding.onboarding.domain.validation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;

import java.util.List;

/**
 * Errors block a submission; warnings are surfaced but never block.
 */
@Builder(toBuilder = true)
public record ValidationResult(@Singular List<String> errors, @Singular List<String> warnings) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ValidationResult valid() {
        return new ValidationResult(List.of(), List.of());
    }

    @JsonProperty("isValid")
    public boolean isValid() {
        return errors.isEmpty();
    }

    public ValidationResult merge(ValidationResult other) {
        return toBuilder().errors(other.errors()).warnings(other.warnings()).build();
    }
}
