package com.openonboarding.onboarding.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of an onboarding session.
 *
 * Writers derive a new snapshot with {@link #toBuilder()} and hand it to the session store together with
 * the version they read; the store bumps {@code version} on every accepted write.
 */
@Getter
@ToString
public class OnboardingSession {

    private final String id;
    private final String hotelId;
    private final String ownerId;
    private final SessionStatus status;
    private final Map<StepId, StepPayload> draft;
    private final Set<StepId> completedSteps;
    private final int qualityScore;
    private final long version;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant expiresAt;

    @Builder(toBuilder = true)
    private OnboardingSession(String id, String hotelId, String ownerId, SessionStatus status,
                              Map<StepId, StepPayload> draft, Set<StepId> completedSteps, int qualityScore,
                              long version, Instant createdAt, Instant updatedAt, Instant expiresAt) {
        this.id = id;
        this.hotelId = hotelId;
        this.ownerId = ownerId;
        this.status = status == null ? SessionStatus.ACTIVE : status;
        EnumMap<StepId, StepPayload> draftCopy = new EnumMap<>(StepId.class);
        if (draft != null) {
            draftCopy.putAll(draft);
        }
        this.draft = Collections.unmodifiableMap(draftCopy);
        EnumSet<StepId> completedCopy = EnumSet.noneOf(StepId.class);
        if (completedSteps != null) {
            completedCopy.addAll(completedSteps);
        }
        this.completedSteps = Collections.unmodifiableSet(completedCopy);
        this.qualityScore = qualityScore;
        this.version = version;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.expiresAt = expiresAt;
    }

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public <P extends StepPayload> Optional<P> step(StepId stepId, Class<P> type) {
        StepPayload payload = draft.get(stepId);
        return type.isInstance(payload) ? Optional.of(type.cast(payload)) : Optional.empty();
    }

    /**
     * Returns a copy with the given payload stored under its step and that step marked completed.
     */
    public OnboardingSession withStep(StepPayload payload) {
        EnumMap<StepId, StepPayload> nextDraft = new EnumMap<>(StepId.class);
        nextDraft.putAll(draft);
        nextDraft.put(payload.stepId(), payload);
        EnumSet<StepId> nextCompleted = EnumSet.noneOf(StepId.class);
        nextCompleted.addAll(completedSteps);
        nextCompleted.add(payload.stepId());
        return toBuilder().draft(nextDraft).completedSteps(nextCompleted).build();
    }
}
