package com.openonboarding.onboarding.domain.quality;

import java.util.List;

public record MissingInformation(String category, List<String> items, RecommendationPriority priority) {

    public MissingInformation {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
