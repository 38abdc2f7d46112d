package com.openonboarding.onboarding.domain.model;

/**
 * Lifecycle of an onboarding session. Only ACTIVE may transition; COMPLETED and ABANDONED are terminal.
 */
public enum SessionStatus {
    ACTIVE,
    COMPLETED,
    ABANDONED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
