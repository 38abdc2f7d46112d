package com.openonboarding.onboarding.config;

import com.openonboarding.onboarding.domain.image.ImageQualityStandards;
import com.openonboarding.onboarding.domain.model.StepId;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Engine thresholds, bound from the {@code onboarding} prefix. An empty configuration yields a working
 * engine.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "onboarding")
public class OnboardingProperties {

    @Valid
    private Session session = new Session();

    @Valid
    private Image image = new Image();

    @Valid
    private Validation validation = new Validation();

    @Valid
    private Quality quality = new Quality();

    @Valid
    private Analysis analysis = new Analysis();

    @Getter
    @Setter
    public static class Session {
        @NotNull
        private Duration ttl = Duration.ofDays(7);

        @NotEmpty
        private List<StepId> requiredSteps = new ArrayList<>(
                List.of(StepId.AMENITIES, StepId.IMAGES, StepId.PROPERTY_INFO, StepId.ROOMS));
    }

    @Getter
    @Setter
    public static class Image {
        @Min(1)
        private int minWidth = 1920;
        @Min(1)
        private int minHeight = 1080;
        @NotEmpty
        private List<Double> aspectRatios = new ArrayList<>(List.of(16.0 / 9.0, 4.0 / 3.0, 3.0 / 2.0, 1.0));
        private double aspectRatioTolerance = 0.1;
        private double minBrightness = 50.0;
        private double maxBrightness = 200.0;
        private double minContrast = 30.0;
        private double blurThreshold = 100.0;
        @Min(0)
        private int highQualityThreshold = 80;

        public ImageQualityStandards toStandards() {
            return new ImageQualityStandards(minWidth, minHeight, aspectRatios, aspectRatioTolerance,
                    minBrightness, maxBrightness, minContrast, blurThreshold, highQualityThreshold);
        }
    }

    @Getter
    @Setter
    public static class Validation {
        @Min(0)
        private int descriptionMinLength = 50;
    }

    @Getter
    @Setter
    public static class Quality {
        @Min(1)
        private int minImageCount = 5;
        @Min(0)
        private int goodThreshold = 70;
    }

    @Getter
    @Setter
    public static class Analysis {
        @Min(1)
        private int corePoolSize = 2;
        @Min(1)
        private int maxPoolSize = 4;
        @Min(0)
        private int queueCapacity = 100;
        @NotNull
        private Duration batchTimeout = Duration.ofSeconds(30);
    }
}
