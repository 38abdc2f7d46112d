package com.openonboarding.onboarding.domain.image;

import com.openonboarding.onboarding.config.OnboardingProperties;
import com.openonboarding.onboarding.domain.model.ImageCategory;
import com.openonboarding.onboarding.domain.model.ImageDimensions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willAnswer;

/**
 * Unit tests for {@link ImageBatchAnalyzer}.
 * Verifies result ordering, isolation of failed tasks and the batch timeout.
 */
@ExtendWith(MockitoExtension.class)
class ImageBatchAnalyzerTest {

    @Mock
    private ImageQualityAnalyzer analyzer;

    private ExecutorService executor;
    private final byte[] first = {1};
    private final byte[] second = {2};
    private final byte[] third = {3};

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Results are returned in submission order")
    void analyzeAll_preservesOrder() {
        // given
        given(analyzer.analyze(same(first))).willReturn(result(91));
        given(analyzer.analyze(same(second))).willReturn(result(72));
        given(analyzer.analyze(same(third))).willReturn(result(55));
        ImageBatchAnalyzer batchAnalyzer = batchAnalyzer(Duration.ofSeconds(5));

        // when
        List<AnalyzedImage> results = batchAnalyzer.analyzeAll(List.of(
                upload("a", first), upload("b", second), upload("c", third)));

        // then
        assertThat(results).extracting(r -> r.upload().id()).containsExactly("a", "b", "c");
        assertThat(results).extracting(r -> r.result().score()).containsExactly(91, 72, 55);
        assertThat(results.get(0).toRecord().dimensions()).isEqualTo(new ImageDimensions(1920, 1080));
    }

    @Test
    @DisplayName("A failing task yields the failure result only for that image")
    void analyzeAll_isolatesFailures() {
        // given
        given(analyzer.analyze(same(first))).willReturn(result(91));
        given(analyzer.analyze(same(second))).willThrow(new IllegalStateException("decoder crashed"));
        ImageBatchAnalyzer batchAnalyzer = batchAnalyzer(Duration.ofSeconds(5));

        // when
        List<AnalyzedImage> results = batchAnalyzer.analyzeAll(List.of(upload("a", first), upload("b", second)));

        // then
        assertThat(results.get(0).result().score()).isEqualTo(91);
        assertThat(results.get(1).result()).isEqualTo(QualityCheckResult.failure());
    }

    @Test
    @DisplayName("Images still running at the batch timeout are reported as failed")
    void analyzeAll_timesOutSlowImages() throws InterruptedException {
        // given
        CountDownLatch release = new CountDownLatch(1);
        given(analyzer.analyze(same(first))).willReturn(result(91));
        willAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return result(99);
        }).given(analyzer).analyze(same(second));
        ImageBatchAnalyzer batchAnalyzer = batchAnalyzer(Duration.ofMillis(200));

        // when
        List<AnalyzedImage> results;
        try {
            results = batchAnalyzer.analyzeAll(List.of(upload("a", first), upload("b", second)));
        } finally {
            release.countDown();
        }

        // then
        assertThat(results.get(0).result().score()).isEqualTo(91);
        assertThat(results.get(1).result().passed()).isFalse();
        assertThat(results.get(1).result().issues()).extracting(QualityIssue::description)
                .containsExactly(QualityCheckResult.FAILURE_DESCRIPTION);
    }

    @Test
    @DisplayName("Empty batch returns an empty list")
    void analyzeAll_emptyBatch() {
        assertThat(batchAnalyzer(Duration.ofSeconds(1)).analyzeAll(List.of())).isEmpty();
    }

    private ImageBatchAnalyzer batchAnalyzer(Duration timeout) {
        OnboardingProperties properties = new OnboardingProperties();
        properties.getAnalysis().setBatchTimeout(timeout);
        return new ImageBatchAnalyzer(analyzer, executor, properties);
    }

    private static ImageUpload upload(String id, byte[] content) {
        return new ImageUpload(id, ImageCategory.ROOMS, "https://cdn.example.com/" + id, content, List.of());
    }

    private static QualityCheckResult result(int score) {
        return new QualityCheckResult(true, score, List.of(), List.of(), new ImageDimensions(1920, 1080));
    }
}
