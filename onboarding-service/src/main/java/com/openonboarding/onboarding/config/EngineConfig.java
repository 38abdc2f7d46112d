package com.openonboarding.onboarding.config;

import com.openonboarding.onboarding.domain.image.ImageDecoder;
import com.openonboarding.onboarding.domain.image.ImageQualityAnalyzer;
import com.openonboarding.onboarding.domain.image.ImageQualityStandards;
import com.openonboarding.onboarding.domain.quality.QualityScoreAggregator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the pure engine components from {@link OnboardingProperties}.
 */
@Configuration
@EnableConfigurationProperties(OnboardingProperties.class)
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ImageQualityStandards imageQualityStandards(OnboardingProperties properties) {
        return properties.getImage().toStandards();
    }

    @Bean
    public ImageQualityAnalyzer imageQualityAnalyzer(ImageQualityStandards standards, ImageDecoder imageDecoder) {
        return new ImageQualityAnalyzer(standards, imageDecoder);
    }

    @Bean
    public QualityScoreAggregator qualityScoreAggregator(OnboardingProperties properties,
                                                         ImageQualityStandards standards) {
        return new QualityScoreAggregator(
                properties.getQuality().getMinImageCount(),
                properties.getQuality().getGoodThreshold(),
                standards);
    }
}
