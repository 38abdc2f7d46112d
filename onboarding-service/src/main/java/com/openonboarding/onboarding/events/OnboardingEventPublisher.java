package com.openonboarding.onboarding.events;

import com.openonboarding.common.util.Constants;
import com.openonboarding.onboarding.domain.model.OnboardingSession;
import com.openonboarding.onboarding.domain.model.StepId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes session lifecycle events to Kafka, keyed by session id.
 *
 * Events published:
 * - OnboardingCompletedEvent: a session reached COMPLETED
 * - OnboardingAbandonedEvent: an expired session was marked ABANDONED
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OnboardingEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Clock clock;

    @Value("${onboarding.events.completed-topic:" + Constants.TOPIC_ONBOARDING_COMPLETED + "}")
    private String completedTopic;

    @Value("${onboarding.events.abandoned-topic:" + Constants.TOPIC_ONBOARDING_ABANDONED + "}")
    private String abandonedTopic;

    public void publishCompleted(OnboardingSession session) {
        OnboardingCompletedEvent event = OnboardingCompletedEvent.builder()
                .sessionId(session.getId())
                .hotelId(session.getHotelId())
                .ownerId(session.getOwnerId())
                .qualityScore(session.getQualityScore())
                .completedSteps(stepIds(session))
                .timestamp(clock.instant())
                .build();

        publishEvent(completedTopic, session.getId(), event);
    }

    public void publishAbandoned(OnboardingSession session) {
        OnboardingAbandonedEvent event = OnboardingAbandonedEvent.builder()
                .sessionId(session.getId())
                .hotelId(session.getHotelId())
                .ownerId(session.getOwnerId())
                .completedSteps(stepIds(session))
                .expiredAt(session.getExpiresAt())
                .timestamp(clock.instant())
                .build();

        publishEvent(abandonedTopic, session.getId(), event);
    }

    private static List<String> stepIds(OnboardingSession session) {
        return session.getCompletedSteps().stream().map(StepId::wireId).toList();
    }

    private void publishEvent(String topic, String key, Object event) {
        log.info("Publishing event to topic {}: {}", topic, event);

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event published to topic {}: offset={}", topic, result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish event to topic {} for session {}", topic, key, ex);
            }
        });
    }
}
