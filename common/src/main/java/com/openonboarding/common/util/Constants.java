package com.openonboarding.common.util;

/**
 * Keys and names shared between the onboarding components.
 */
public final class Constants {
    private Constants() {
    }

    public static final String LOCK_PREFIX = "lock:onboarding-session:";

    public static final String TOPIC_ONBOARDING_COMPLETED = "onboarding-completed";
    public static final String TOPIC_ONBOARDING_ABANDONED = "onboarding-abandoned";

    public static final String API_BASE_PATH = "/api/v1/onboarding";
}
