package com.openonboarding.onboarding.domain.model;

import java.util.List;

public record RoomsPayload(List<RoomRecord> rooms) implements StepPayload {

    public RoomsPayload {
        rooms = rooms == null ? List.of() : List.copyOf(rooms);
    }

    @Override
    public StepId stepId() {
        return StepId.ROOMS;
    }
}
