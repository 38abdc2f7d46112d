package com.openonboarding.onboarding.domain.service;

/**
 * @param alreadyCompleted true when the session had been completed by an earlier call
 */
public record CompletionResult(String sessionId, int qualityScore, boolean alreadyCompleted) {
}
