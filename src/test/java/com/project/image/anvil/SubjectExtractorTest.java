package com.project.image.anvil;

import com.project.image.anvil.DTOs.ModelUsed;
import com.project.image.anvil.DTOs.SubjectMask;
import com.project.image.anvil.exceptions.ExtractionFailureException;
import com.project.image.anvil.service.SubjectExtractor;
import com.project.image.anvil.service.segmentation.LazySegmentationModel;
import com.project.image.anvil.service.segmentation.SegmentationModels;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubjectExtractorTest {
    private final BufferedImage image = TestImages.noise(64, 36, 1);
    private SegmentationModels models;

    @AfterEach
    void tearDown() {
        if (models != null) {
            models.close();
        }
    }

    private SubjectExtractor extractor(FakeSegmentationModel primary, FakeSegmentationModel fallback, Duration timeout) {
        models = new SegmentationModels(primary, fallback);
        return new SubjectExtractor(models, timeout);
    }

    @Test
    void extractSubject_primaryWorks_usesPrimary() {
        FakeSegmentationModel primary = new FakeSegmentationModel("primary").alpha(200);
        FakeSegmentationModel fallback = new FakeSegmentationModel("fallback");

        SubjectMask mask = extractor(primary, fallback, Duration.ofSeconds(5)).extractSubject(image);

        assertThat(mask.modelUsed()).isEqualTo(ModelUsed.PRIMARY);
        assertThat(mask.width()).isEqualTo(64);
        assertThat(mask.height()).isEqualTo(36);
        assertThat(mask.alphaAt(0)).isEqualTo(200);
        assertThat(fallback.predictions.get()).isZero();
    }

    @Test
    void extractSubject_primaryUnavailable_fallsBackAndRemembersFailure() {
        FakeSegmentationModel primary = new FakeSegmentationModel("primary").failingLoad();
        FakeSegmentationModel fallback = new FakeSegmentationModel("fallback").alpha(128);
        SubjectExtractor extractor = extractor(primary, fallback, Duration.ofSeconds(5));

        SubjectMask first = extractor.extractSubject(image);
        SubjectMask second = extractor.extractSubject(image);

        assertThat(first.modelUsed()).isEqualTo(ModelUsed.FALLBACK);
        assertThat(second.modelUsed()).isEqualTo(ModelUsed.FALLBACK);
        assertThat(first.alphaAt(10)).isEqualTo(128);
        assertThat(primary.loads.get()).isEqualTo(1);
        assertThat(fallback.loads.get()).isEqualTo(1);
    }

    @Test
    void extractSubject_bothFail_returnsDegradedFullFrame() {
        FakeSegmentationModel primary = new FakeSegmentationModel("primary").failingPredict();
        FakeSegmentationModel fallback = new FakeSegmentationModel("fallback").failingLoad();

        SubjectMask mask = extractor(primary, fallback, Duration.ofSeconds(5)).extractSubject(image);

        assertThat(mask.modelUsed()).isEqualTo(ModelUsed.DEGRADED);
        assertThat(mask.isDegraded()).isTrue();
        for (int i = 0; i < 64 * 36; i++) {
            assertThat(mask.alphaAt(i)).isEqualTo(255);
        }
    }

    @Test
    void extractSubject_primaryTimesOut_fallsBack() {
        FakeSegmentationModel primary = new FakeSegmentationModel("primary").slowPredict(10_000);
        FakeSegmentationModel fallback = new FakeSegmentationModel("fallback");

        long start = System.nanoTime();
        SubjectMask mask = extractor(primary, fallback, Duration.ofMillis(200)).extractSubject(image);

        assertThat(mask.modelUsed()).isEqualTo(ModelUsed.FALLBACK);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    void extractSubject_stuckModelsIgnoringInterrupts_doNotPileUpInferenceThreads() {
        FakeSegmentationModel primary = new FakeSegmentationModel("stuck-primary").stubbornPredict(5_000);
        FakeSegmentationModel fallback = new FakeSegmentationModel("stuck-fallback").stubbornPredict(5_000);
        SubjectExtractor extractor = extractor(primary, fallback, Duration.ofMillis(100));

        for (int i = 0; i < 10; i++) {
            assertThat(extractor.extractSubject(image).modelUsed()).isEqualTo(ModelUsed.DEGRADED);
        }

        long liveInferenceThreads = Thread.getAllStackTraces().keySet().stream()
                .filter(Thread::isAlive)
                .filter(t -> t.getName().startsWith("anvil.inference-stuck-"))
                .count();
        assertThat(liveInferenceThreads).isLessThanOrEqualTo(2);
        // abandoned requests never reach the model once its thread frees up
        assertThat(primary.predictions).hasValue(1);
        assertThat(fallback.predictions).hasValue(1);
    }

    @Test
    void lazyModel_waitingForInference_canBeInterrupted() throws Exception {
        LazySegmentationModel model = new LazySegmentationModel(
                new FakeSegmentationModel("busy").slowPredict(5_000));
        Thread holder = new Thread(() -> {
            try {
                model.predict(image);
            } catch (ExtractionFailureException ignored) {
                // interrupted at teardown
            }
        });
        holder.start();
        while (!model.isReady()) {
            Thread.sleep(10);
        }
        Thread.sleep(50);

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread waiter = new Thread(() -> {
            try {
                model.predict(image);
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        waiter.start();
        Thread.sleep(50);
        waiter.interrupt();
        waiter.join(2_000);
        holder.interrupt();

        assertThat(waiter.isAlive()).isFalse();
        assertThat(failure.get()).isInstanceOf(ExtractionFailureException.class).hasMessageContaining("Interrupted");
    }

    @Test
    void extractSubject_wrongSizedMask_isTreatedAsFailure() {
        FakeSegmentationModel primary = new FakeSegmentationModel("primary").wrongSize();
        FakeSegmentationModel fallback = new FakeSegmentationModel("fallback");

        SubjectMask mask = extractor(primary, fallback, Duration.ofSeconds(5)).extractSubject(image);

        assertThat(mask.modelUsed()).isEqualTo(ModelUsed.FALLBACK);
    }

    @Test
    void lazyModel_concurrentFirstUse_loadsOnce() throws Exception {
        FakeSegmentationModel delegate = new FakeSegmentationModel("slow").slowLoad(100);
        LazySegmentationModel model = new LazySegmentationModel(delegate);
        int threads = 8;
        CountDownLatch gate = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<byte[]>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    gate.await();
                    return model.predict(image);
                }));
            }
            gate.countDown();
            for (Future<byte[]> result : results) {
                assertThat(result.get()).hasSize(64 * 36);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(delegate.loads.get()).isEqualTo(1);
        assertThat(delegate.predictions.get()).isEqualTo(threads);
        assertThat(model.isReady()).isTrue();
    }

    @Test
    void lazyModel_failedLoad_isNotRetried() {
        FakeSegmentationModel delegate = new FakeSegmentationModel("broken").failingLoad();
        LazySegmentationModel model = new LazySegmentationModel(delegate);

        assertThatThrownBy(() -> model.predict(image)).isInstanceOf(ExtractionFailureException.class)
                .hasMessageContaining("broken weights missing");
        assertThatThrownBy(() -> model.predict(image)).isInstanceOf(ExtractionFailureException.class);

        assertThat(delegate.loads.get()).isEqualTo(1);
        assertThat(model.isReady()).isFalse();
    }
}
