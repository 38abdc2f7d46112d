package com.openonboarding.onboarding.domain.validation;

import com.openonboarding.onboarding.domain.amenity.AmenityCatalogSnapshot;
import com.openonboarding.onboarding.domain.model.StepId;
import com.openonboarding.onboarding.domain.model.StepPayload;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only inputs a step validator may consult besides the payload itself.
 *
 * @param draft snapshot of the other steps, consulted only when {@code validateDependencies} is set
 */
public record ValidationContext(AmenityCatalogSnapshot catalog, boolean validateDependencies,
                                Map<StepId, StepPayload> draft) {

    public ValidationContext {
        draft = draft == null ? Map.of() : Map.copyOf(draft);
    }

    public static ValidationContext standalone(AmenityCatalogSnapshot catalog) {
        return new ValidationContext(catalog, false, Map.of());
    }

    public <P extends StepPayload> Optional<P> draftStep(StepId stepId, Class<P> type) {
        StepPayload payload = draft.get(stepId);
        return type.isInstance(payload) ? Optional.of(type.cast(payload)) : Optional.empty();
    }
}
