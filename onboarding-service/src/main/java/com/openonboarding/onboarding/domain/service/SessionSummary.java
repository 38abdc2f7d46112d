package com.openonboarding.onboarding.domain.service;

import com.openonboarding.onboarding.domain.model.SessionStatus;

import java.time.Instant;

public record SessionSummary(String sessionId, SessionStatus status, Instant expiresAt) {
}
