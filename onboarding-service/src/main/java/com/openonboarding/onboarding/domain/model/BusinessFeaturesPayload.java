package com.openonboarding.onboarding.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Facilities for business travellers. The whole step is optional.
 */
public record BusinessFeaturesPayload(
        List<MeetingRoom> meetingRooms,
        Connectivity connectivity,
        List<WorkSpace> workSpaces,
        List<String> services
) implements StepPayload {

    public BusinessFeaturesPayload {
        meetingRooms = meetingRooms == null ? List.of() : List.copyOf(meetingRooms);
        workSpaces = workSpaces == null ? List.of() : List.copyOf(workSpaces);
        services = services == null ? List.of() : List.copyOf(services);
    }

    @Override
    public StepId stepId() {
        return StepId.BUSINESS_FEATURES;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return meetingRooms.isEmpty() && workSpaces.isEmpty() && services.isEmpty() && connectivity == null;
    }

    public record MeetingRoom(String id, String name, Integer capacity) {
    }

    public record WorkSpace(String id, String name, Integer capacity) {
    }

    public record Connectivity(WifiSpeed wifiSpeed) {
    }

    public record WifiSpeed(Integer download, Integer upload, Integer latency) {
    }
}
