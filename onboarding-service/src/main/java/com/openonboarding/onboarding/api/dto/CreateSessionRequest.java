package com.openonboarding.onboarding.api.dto;

import jakarta.validation.constraints.NotBlank;

public record CreateSessionRequest(
        @NotBlank(message = "Hotel ID cannot be blank")
        String hotelId,

        @NotBlank(message = "Owner ID cannot be blank")
        String ownerId
) {
}
