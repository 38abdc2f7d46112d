package com.openonboarding.onboarding.domain.quality;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param score   0-100
 * @param weight  share of the overall score
 * @param factors contributing factor scores (0-100 each) in evaluation order
 */
public record ComponentScore(int score, double weight, Map<String, Integer> factors) {

    public ComponentScore {
        factors = factors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(factors));
    }
}
