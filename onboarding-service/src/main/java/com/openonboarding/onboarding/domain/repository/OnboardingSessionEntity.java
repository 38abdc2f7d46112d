package com.openonboarding.onboarding.domain.repository;

import com.openonboarding.onboarding.domain.model.SessionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Row form of an onboarding session. The draft is stored as JSON keyed by step wire id.
 * {@code version} is maintained by the guarded update in {@link OnboardingSessionRepository}.
 */
@Entity
@Table(name = "onboarding_sessions", indexes = {
        @Index(name = "idx_onboarding_status_expires", columnList = "status,expires_at"),
        @Index(name = "idx_onboarding_hotel", columnList = "hotel_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OnboardingSessionEntity {
    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "hotel_id", nullable = false)
    private String hotelId;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SessionStatus status;

    @Column(name = "draft_json", nullable = false, columnDefinition = "text")
    private String draftJson;

    /** Comma-separated step wire ids. */
    @Column(name = "completed_steps", nullable = false)
    private String completedSteps;

    @Column(name = "quality_score", nullable = false)
    private int qualityScore;

    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;
}
