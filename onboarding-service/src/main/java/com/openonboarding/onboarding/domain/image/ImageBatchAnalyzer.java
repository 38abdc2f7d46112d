package com.openonboarding.onboarding.domain.image;

import com.openonboarding.common.exception.BusinessException;
import com.openonboarding.onboarding.config.OnboardingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Analyzes a batch of uploads in parallel on the {@code imageAnalysisExecutor}.
 *
 * Each image is an independent task. Results come back in submission order. Images still running when
 * the batch timeout elapses are cancelled and reported with the failing analysis result, as are images
 * whose task failed; the rest of the batch is unaffected.
 */
@Slf4j
@Component
public class ImageBatchAnalyzer {

    private final ImageQualityAnalyzer analyzer;
    private final Executor executor;
    private final Duration batchTimeout;

    public ImageBatchAnalyzer(ImageQualityAnalyzer analyzer,
                              @Qualifier("imageAnalysisExecutor") Executor executor,
                              OnboardingProperties properties) {
        this.analyzer = analyzer;
        this.executor = executor;
        this.batchTimeout = properties.getAnalysis().getBatchTimeout();
    }

    public List<AnalyzedImage> analyzeAll(List<ImageUpload> uploads) {
        List<CompletableFuture<QualityCheckResult>> futures = new ArrayList<>(uploads.size());
        for (ImageUpload upload : uploads) {
            futures.add(CompletableFuture.supplyAsync(() -> analyzer.analyze(upload.content()), executor));
        }

        long deadline = System.nanoTime() + batchTimeout.toNanos();
        List<AnalyzedImage> results = new ArrayList<>(uploads.size());
        for (int i = 0; i < uploads.size(); i++) {
            ImageUpload upload = uploads.get(i);
            CompletableFuture<QualityCheckResult> future = futures.get(i);
            results.add(new AnalyzedImage(upload, await(upload, future, deadline, futures)));
        }

        long failed = results.stream().filter(r -> !r.result().passed()).count();
        log.info("Analyzed {} images, {} did not pass", results.size(), failed);
        return results;
    }

    private QualityCheckResult await(ImageUpload upload, CompletableFuture<QualityCheckResult> future,
                                     long deadline, List<CompletableFuture<QualityCheckResult>> batch) {
        long remaining = Math.max(0L, deadline - System.nanoTime());
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Analysis of image {} did not finish within {}, marking it as failed", upload.id(), batchTimeout);
            return QualityCheckResult.failure();
        } catch (ExecutionException e) {
            log.warn("Analysis of image {} failed: {}", upload.id(), e.getCause().getMessage());
            return QualityCheckResult.failure();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            batch.forEach(f -> f.cancel(true));
            throw new BusinessException("Image analysis interrupted", e, "IMAGE_ANALYSIS_INTERRUPTED");
        }
    }
}
