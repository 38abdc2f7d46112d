package com.openonboarding.onboarding.domain.model;

public record PropertyInfoPayload(
        String description,
        HotelPolicies policies,
        LocationDetails locationDetails
) implements StepPayload {

    @Override
    public StepId stepId() {
        return StepId.PROPERTY_INFO;
    }
}
