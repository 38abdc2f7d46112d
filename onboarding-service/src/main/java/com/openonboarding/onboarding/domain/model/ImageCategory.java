package com.openonboarding.onboarding.domain.model;

import java.util.List;

public enum ImageCategory {
    EXTERIOR,
    LOBBY,
    ROOMS,
    AMENITIES,
    DINING,
    RECREATIONAL,
    BUSINESS,
    VIRTUAL_TOURS;

    /** Categories every listing is expected to cover. */
    public static final List<ImageCategory> ESSENTIAL = List.of(EXTERIOR, LOBBY, ROOMS);
}
