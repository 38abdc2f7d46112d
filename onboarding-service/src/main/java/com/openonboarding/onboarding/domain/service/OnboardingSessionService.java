package com.openonboarding.onboarding.domain.service;

import com.openonboarding.common.exception.ResourceNotFoundException;
import com.openonboarding.onboarding.config.OnboardingProperties;
import com.openonboarding.onboarding.domain.image.AnalyzedImage;
import com.openonboarding.onboarding.domain.image.ImageBatchAnalyzer;
import com.openonboarding.onboarding.domain.image.ImageUpload;
import com.openonboarding.onboarding.domain.model.ImageRecord;
import com.openonboarding.onboarding.domain.model.ImagesPayload;
import com.openonboarding.onboarding.domain.model.OnboardingSession;
import com.openonboarding.onboarding.domain.model.SessionStatus;
import com.openonboarding.onboarding.domain.model.StepId;
import com.openonboarding.onboarding.domain.model.StepPayload;
import com.openonboarding.onboarding.domain.quality.QualityAssessment;
import com.openonboarding.onboarding.domain.quality.QualityScoreAggregator;
import com.openonboarding.onboarding.domain.quality.QualityScoreBreakdown;
import com.openonboarding.onboarding.domain.repository.OnboardingSessionStore;
import com.openonboarding.onboarding.domain.strategy.AbstractSessionWriteStrategy;
import com.openonboarding.onboarding.domain.strategy.SessionMutationResult;
import com.openonboarding.onboarding.domain.strategy.SessionWriteStrategy;
import com.openonboarding.onboarding.domain.validation.StepValidationService;
import com.openonboarding.onboarding.domain.validation.ValidationResult;
import com.openonboarding.onboarding.events.OnboardingEventPublisher;
import com.openonboarding.onboarding.exception.InvalidSessionStateException;
import com.openonboarding.onboarding.exception.SessionExpiredException;
import com.openonboarding.onboarding.exception.ValidationException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the onboarding session lifecycle: creation, step updates, completion and expiry.
 *
 * Every write runs as one read-validate-merge-write unit through the configured
 * {@link SessionWriteStrategy}, selected from the strategy beans by name (Spring Map injection):
 * - local: per-session lock inside this JVM
 * - distributed: Redisson lock
 * - optimistic: compare-and-swap with retry
 *
 * Configuration:
 * onboarding.session.write-strategy: local | distributed | optimistic
 *
 * Events are published only after the write that caused them succeeded, and only by the caller that
 * performed the transition, so concurrent completions publish a single event.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OnboardingSessionService {

    private static final String DEFAULT_STRATEGY = "local";

    private final Map<String, SessionWriteStrategy> writeStrategies;
    private final OnboardingSessionStore sessionStore;
    private final StepValidationService validationService;
    private final DraftMerger draftMerger;
    private final QualityScoreAggregator qualityScoreAggregator;
    private final ImageBatchAnalyzer imageBatchAnalyzer;
    private final OnboardingEventPublisher eventPublisher;
    private final OnboardingProperties properties;
    private final Clock clock;

    @Value("${onboarding.session.write-strategy:local}")
    private String strategyType;

    @PostConstruct
    public void init() {
        SessionWriteStrategy strategy = getWriteStrategy();
        log.info("Initialized OnboardingSessionService with strategy {}, session TTL {}, required steps {}",
                strategy.getStrategyType(), properties.getSession().getTtl(),
                properties.getSession().getRequiredSteps());
    }

    /**
     * Starts onboarding for a hotel. When the owner already has an unexpired ACTIVE session for the hotel,
     * that session is returned instead of a new one.
     */
    public SessionSummary createSession(String hotelId, String ownerId) {
        ValidationResult.ValidationResultBuilder problems = ValidationResult.builder();
        if (hotelId == null || hotelId.isBlank()) {
            problems.error("hotelId is required");
        }
        if (ownerId == null || ownerId.isBlank()) {
            problems.error("ownerId is required");
        }
        ValidationResult validation = problems.build();
        if (!validation.isValid()) {
            throw new ValidationException(validation);
        }

        Instant now = clock.instant();
        Optional<OnboardingSession> existing = sessionStore.findLatestActive(hotelId, ownerId)
                .filter(active -> !active.isExpiredAt(now));
        if (existing.isPresent()) {
            OnboardingSession active = existing.get();
            log.info("Resuming onboarding session {} for hotel {}", active.getId(), hotelId);
            return new SessionSummary(active.getId(), active.getStatus(), active.getExpiresAt());
        }

        OnboardingSession session = OnboardingSession.builder()
                .id(UUID.randomUUID().toString())
                .hotelId(hotelId)
                .ownerId(ownerId)
                .status(SessionStatus.ACTIVE)
                .qualityScore(qualityScoreAggregator.score(Map.of()).overall())
                .version(0L)
                .createdAt(now)
                .updatedAt(now)
                .expiresAt(now.plus(properties.getSession().getTtl()))
                .build();
        sessionStore.save(session);

        log.info("Created onboarding session {} for hotel {} (expires {})",
                session.getId(), hotelId, session.getExpiresAt());
        return new SessionSummary(session.getId(), session.getStatus(), session.getExpiresAt());
    }

    /**
     * Validates the payload and merges it into the session draft. A rejected payload leaves the session
     * untouched; a payload identical to what is stored is accepted without a write.
     */
    public StepUpdateResult updateStep(String sessionId, StepId stepId, StepPayload payload) {
        StepUpdateResult result = getWriteStrategy().execute(sessionId, current -> {
            requireWritable(current, "update");

            ValidationResult validation = validationService.validate(stepId, payload);
            if (!validation.isValid()) {
                log.warn("Rejected {} update for session {}: {}", stepId.wireId(), sessionId, validation.errors());
                throw new ValidationException(validation);
            }

            StepPayload stored = current.getDraft().get(stepId);
            StepPayload merged = draftMerger.merge(stored, payload);
            OnboardingSession next = current.withStep(merged);
            QualityScoreBreakdown breakdown = qualityScoreAggregator.score(next.getDraft());

            if (Objects.equals(stored, merged) && current.getCompletedSteps().contains(stepId)) {
                return SessionMutationResult.unchanged(new StepUpdateResult(
                        stepId, current.getQualityScore(), breakdown, validation.warnings(), false));
            }

            next = next.toBuilder()
                    .qualityScore(breakdown.overall())
                    .updatedAt(clock.instant())
                    .build();
            return SessionMutationResult.write(next, new StepUpdateResult(
                    stepId, breakdown.overall(), breakdown, validation.warnings(), true));
        });

        if (result.changed()) {
            log.info("Session {} step {} updated, quality score {}", sessionId, stepId.wireId(), result.qualityScore());
        }
        return result;
    }

    /**
     * Analyzes the uploads in parallel and stores them as an images step update. Failing images are
     * kept with their zero score so the operator sees what went wrong.
     */
    public ImageUploadResult uploadImages(String sessionId, List<ImageUpload> uploads) {
        OnboardingSession session = loadSession(sessionId);
        requireWritable(session, "upload images to");

        List<AnalyzedImage> analyzed = imageBatchAnalyzer.analyzeAll(uploads);
        List<ImageRecord> records = analyzed.stream().map(AnalyzedImage::toRecord).toList();
        StepUpdateResult update = updateStep(sessionId, StepId.IMAGES, new ImagesPayload(records));
        return new ImageUploadResult(analyzed, update);
    }

    /**
     * Validates a payload without touching any session.
     */
    public ValidationResult validateStep(StepId stepId, StepPayload payload, boolean validateDependencies,
                                         Map<StepId, StepPayload> draftSnapshot) {
        return validationService.validate(stepId, payload, validateDependencies, draftSnapshot);
    }

    /**
     * Returns the session with its assessment. An active session found past its expiry is marked
     * ABANDONED before it is returned.
     */
    public SessionStatusView getStatus(String sessionId) {
        OnboardingSession session = loadSession(sessionId);
        if (session.isActive() && session.isExpiredAt(clock.instant())) {
            session = abandonIfExpired(sessionId).session();
        }
        QualityAssessment assessment = qualityScoreAggregator.assess(session.getDraft());
        return new SessionStatusView(session, assessment, progress(session));
    }

    /**
     * Completes the session when every required step is done. Only the caller that performs the
     * transition publishes the completion event; later callers get {@code alreadyCompleted = true}.
     */
    public CompletionResult complete(String sessionId) {
        Transition transition = getWriteStrategy().execute(sessionId, current -> {
            if (current.getStatus() == SessionStatus.COMPLETED) {
                return SessionMutationResult.unchanged(new Transition(current, false));
            }
            requireWritable(current, "complete");

            List<StepId> missing = missingRequiredSteps(current);
            if (!missing.isEmpty()) {
                log.warn("Session {} cannot be completed, missing steps {}", sessionId, missing);
                throw ValidationException.missingSteps(missing);
            }

            OnboardingSession completed = current.toBuilder()
                    .status(SessionStatus.COMPLETED)
                    .qualityScore(qualityScoreAggregator.score(current.getDraft()).overall())
                    .updatedAt(clock.instant())
                    .build();
            return SessionMutationResult.write(completed, new Transition(completed, true));
        });

        OnboardingSession session = transition.session();
        if (!transition.changed()) {
            log.info("Session {} was already completed", sessionId);
            return new CompletionResult(sessionId, session.getQualityScore(), true);
        }

        log.info("Session {} completed with quality score {}", sessionId, session.getQualityScore());
        eventPublisher.publishCompleted(session);
        return new CompletionResult(sessionId, session.getQualityScore(), false);
    }

    /**
     * Marks every active session past its expiry as ABANDONED.
     *
     * @return number of sessions abandoned by this sweep
     */
    public int sweepExpiredSessions() {
        List<OnboardingSession> expired = sessionStore.findActiveExpiredBefore(clock.instant());
        if (expired.isEmpty()) {
            return 0;
        }
        int abandoned = 0;
        for (OnboardingSession candidate : expired) {
            try {
                if (abandonIfExpired(candidate.getId()).changed()) {
                    abandoned++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to abandon expired session {}", candidate.getId(), e);
            }
        }
        log.info("Expiry sweep abandoned {} of {} expired session(s)", abandoned, expired.size());
        return abandoned;
    }

    private Transition abandonIfExpired(String sessionId) {
        Transition transition = getWriteStrategy().execute(sessionId, current -> {
            if (!current.isActive() || !current.isExpiredAt(clock.instant())) {
                return SessionMutationResult.unchanged(new Transition(current, false));
            }
            OnboardingSession abandoned = current.toBuilder()
                    .status(SessionStatus.ABANDONED)
                    .updatedAt(clock.instant())
                    .build();
            return SessionMutationResult.write(abandoned, new Transition(abandoned, true));
        });
        if (transition.changed()) {
            log.info("Session {} expired at {} and was abandoned", sessionId, transition.session().getExpiresAt());
            eventPublisher.publishAbandoned(transition.session());
        }
        return transition;
    }

    private void requireWritable(OnboardingSession session, String operation) {
        if (!session.isActive()) {
            log.warn("Rejected attempt to {} session {} in status {}", operation, session.getId(), session.getStatus());
            throw new InvalidSessionStateException(session.getId(), session.getStatus(), operation);
        }
        if (session.isExpiredAt(clock.instant())) {
            throw new SessionExpiredException(session.getId(), session.getExpiresAt());
        }
    }

    private List<StepId> missingRequiredSteps(OnboardingSession session) {
        return properties.getSession().getRequiredSteps().stream()
                .distinct()
                .filter(step -> !session.getCompletedSteps().contains(step))
                .sorted()
                .toList();
    }

    private SessionProgress progress(OnboardingSession session) {
        List<StepId> required = properties.getSession().getRequiredSteps().stream().distinct().toList();
        List<StepId> missing = missingRequiredSteps(session);
        return new SessionProgress(
                required.size() - missing.size(),
                required.size(),
                StepId.values().length,
                List.copyOf(session.getCompletedSteps()),
                missing);
    }

    private OnboardingSession loadSession(String sessionId) {
        return sessionStore.load(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException(AbstractSessionWriteStrategy.SESSION_RESOURCE, sessionId));
    }

    private SessionWriteStrategy getWriteStrategy() {
        SessionWriteStrategy strategy = writeStrategies.get(strategyType);
        if (strategy == null) {
            log.warn("Unknown write strategy '{}', falling back to '{}'", strategyType, DEFAULT_STRATEGY);
            strategy = writeStrategies.get(DEFAULT_STRATEGY);
        }
        if (strategy == null) {
            throw new IllegalStateException("No session write strategy available");
        }
        return strategy;
    }

    private record Transition(OnboardingSession session, boolean changed) {
    }
}
