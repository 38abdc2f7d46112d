package com.openonboarding.onboarding.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executor for CPU-bound image analysis. When the queue is full the submitting thread runs the task
 * itself, so a large batch slows down instead of failing.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "imageAnalysisExecutor")
    public Executor imageAnalysisExecutor(OnboardingProperties properties) {
        OnboardingProperties.Analysis analysis = properties.getAnalysis();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(analysis.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(analysis.getCorePoolSize(), analysis.getMaxPoolSize()));
        executor.setQueueCapacity(analysis.getQueueCapacity());
        executor.setThreadNamePrefix("image-analysis-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
