package com.openonboarding.onboarding.domain.repository;

import com.openonboarding.onboarding.domain.model.SessionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface OnboardingSessionRepository extends JpaRepository<OnboardingSessionEntity, String> {

    List<OnboardingSessionEntity> findByStatusAndExpiresAtBeforeOrderByExpiresAtAsc(SessionStatus status, Instant now);

    Optional<OnboardingSessionEntity> findFirstByHotelIdAndOwnerIdAndStatusOrderByCreatedAtDesc(
            String hotelId, String ownerId, SessionStatus status);

    /**
     * Writes a new session state only if nobody changed the row since {@code expectedVersion} was read.
     *
     * @return 1 when the row was updated, 0 on a version conflict or unknown id
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE OnboardingSessionEntity s
           SET s.status = :status,
               s.draftJson = :draftJson,
               s.completedSteps = :completedSteps,
               s.qualityScore = :qualityScore,
               s.updatedAt = :updatedAt,
               s.expiresAt = :expiresAt,
               s.version = s.version + 1
           WHERE s.id = :id
             AND s.version = :expectedVersion
           """)
    int updateIfVersionMatches(@Param("id") String id,
                               @Param("expectedVersion") long expectedVersion,
                               @Param("status") SessionStatus status,
                               @Param("draftJson") String draftJson,
                               @Param("completedSteps") String completedSteps,
                               @Param("qualityScore") int qualityScore,
                               @Param("updatedAt") Instant updatedAt,
                               @Param("expiresAt") Instant expiresAt);
}
