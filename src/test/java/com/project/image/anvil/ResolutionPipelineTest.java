package com.project.image.anvil;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.image.anvil.DTOs.AnvilPolygon;
import com.project.image.anvil.DTOs.AnvilSpec;
import com.project.image.anvil.DTOs.AspectRatio;
import com.project.image.anvil.DTOs.ExportFormat;
import com.project.image.anvil.DTOs.JobKind;
import com.project.image.anvil.DTOs.JobRequest;
import com.project.image.anvil.DTOs.LayerPackage;
import com.project.image.anvil.DTOs.ModelUsed;
import com.project.image.anvil.DTOs.ProcessingResult;
import com.project.image.anvil.DTOs.RgbColor;
import com.project.image.anvil.DTOs.ShapeMask;
import com.project.image.anvil.DTOs.Style;
import com.project.image.anvil.DTOs.StyleResult;
import com.project.image.anvil.config.AnvilProperties;
import com.project.image.anvil.exceptions.ProcessingTimeoutException;
import com.project.image.anvil.exceptions.ResourceExhaustionException;
import com.project.image.anvil.exceptions.SpecValidationException;
import com.project.image.anvil.service.GradientPalette;
import com.project.image.anvil.service.ImageCodec;
import com.project.image.anvil.service.LayerExporter;
import com.project.image.anvil.service.Pixels;
import com.project.image.anvil.service.ResolutionPipeline;
import com.project.image.anvil.service.ShapeEngine;
import com.project.image.anvil.service.StepRunner;
import com.project.image.anvil.service.StyleCompositor;
import com.project.image.anvil.service.SubjectExtractor;
import com.project.image.anvil.service.segmentation.SegmentationModels;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResolutionPipelineTest {
    private static final RgbColor BLUE = RgbColor.fromHex("#0070F2");

    private final StyleCompositor compositor = new StyleCompositor(
            new GradientPalette(List.of(0.75, 0.5, 0.25, 0.0, -0.25)), 0.02);
    private final LayerExporter exporter = new LayerExporter(compositor, new ObjectMapper(),
            Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC));
    private final StepRunner stepRunner = new StepRunner();
    private final AnvilProperties.Pipeline settings = new AnvilProperties().getPipeline();
    private SegmentationModels models;

    @AfterEach
    void tearDown() {
        stepRunner.close();
        if (models != null) {
            models.close();
        }
    }

    private ResolutionPipeline pipeline(FakeSegmentationModel primary, FakeSegmentationModel fallback,
                                        Duration inferenceTimeout, Duration extractionBudget) {
        models = new SegmentationModels(primary, fallback);
        return new ResolutionPipeline(new ShapeEngine(AnvilPolygon.DEFAULT),
                new SubjectExtractor(models, inferenceTimeout), compositor, exporter, stepRunner,
                settings, extractionBudget);
    }

    private ResolutionPipeline pipeline(FakeSegmentationModel primary, FakeSegmentationModel fallback) {
        return pipeline(primary, fallback, Duration.ofSeconds(5), Duration.ofSeconds(15));
    }

    @Test
    void preview_rendersAllSixStylesAtPreviewSize() {
        settings.setPreviewMaxEdge(200);
        FakeSegmentationModel primary = new FakeSegmentationModel("primary").alpha(255);
        ResolutionPipeline pipeline = pipeline(primary, new FakeSegmentationModel("fallback"));
        AnvilSpec spec = new AnvilSpec(0.8, 0, 0, BLUE, 0.5, AspectRatio.LANDSCAPE_16_9);

        ProcessingResult result = pipeline.process(JobRequest.preview(TestImages.noise(400, 300, 2), spec, "beach"));

        assertThat(result.kind()).isEqualTo(JobKind.PREVIEW);
        assertThat(result.styles()).extracting(StyleResult::style).containsExactly(Style.values());
        assertThat(result.imagesByStyleName()).containsOnlyKeys(
                "Flat", "Stroke", "Gradient", "Window", "Silhouette", "Gradient Silhouette");
        assertThat(result.modelUsed()).isEqualTo(ModelUsed.PRIMARY);
        assertThat(result.layerPackage()).isNull();
        // 400x300 cropped to 400x225, then fitted to a 200 edge
        for (StyleResult style : result.styles()) {
            BufferedImage decoded = ImageCodec.readPng(style.imageBytes());
            assertThat(decoded.getWidth()).isEqualTo(200);
            assertThat(decoded.getHeight()).isEqualTo(113);
        }
        assertThat(primary.predictions.get()).isEqualTo(1);
    }

    @Test
    void preview_fullHdPhoto_flatShowsColourInsideShapeAndPhotoOutside() {
        ResolutionPipeline pipeline = pipeline(new FakeSegmentationModel("primary"), new FakeSegmentationModel("fallback"));
        AnvilSpec spec = new AnvilSpec(0.7, 0, 0, BLUE, 0.5, AspectRatio.LANDSCAPE_16_9);
        BufferedImage photo = TestImages.solid(1920, 1080, 0x808080);

        ProcessingResult result = pipeline.process(JobRequest.preview(photo, spec, "hd"));

        assertThat(result.styles()).hasSize(6);
        for (StyleResult style : result.styles()) {
            assertThat(style.width()).isEqualTo(1920);
            assertThat(style.height()).isEqualTo(1080);
        }
        ShapeMask shape = new ShapeEngine(AnvilPolygon.DEFAULT).computeShapeMask(1920, 1080, spec);
        int tinted = Pixels.over(Pixels.withAlpha(BLUE.argb(), 128), photo.getRGB(0, 0));
        int[] flat = TestImages.pixels(ImageCodec.readPng(result.style(Style.FLAT).orElseThrow().imageBytes()));
        int mismatches = 0;
        for (int i = 0; i < flat.length; i++) {
            int expected = shape.isInside(i) ? tinted : photo.getRGB(0, 0);
            if (flat[i] != expected) {
                mismatches++;
            }
        }
        assertThat(mismatches).isZero();
        assertThat(shape.pixelBounds()).isNotNull();
    }

    @Test
    void advanced_nonSubjectStyle_skipsExtraction() {
        FakeSegmentationModel primary = new FakeSegmentationModel("primary");
        ResolutionPipeline pipeline = pipeline(primary, new FakeSegmentationModel("fallback"));
        BufferedImage photo = TestImages.noise(320, 180, 4);

        ProcessingResult result = pipeline.process(JobRequest.advanced(photo,
                AnvilSpec.defaults(BLUE, AspectRatio.LANDSCAPE_16_9), Style.FLAT, ExportFormat.IMAGE, "shot"));

        assertThat(result.styles()).hasSize(1);
        assertThat(result.modelUsed()).isNull();
        assertThat(result.autoDownscaled()).isFalse();
        assertThat(result.downloadName(Style.FLAT)).isEqualTo("shot_flat_Blue2.png");
        assertThat(primary.predictions.get()).isZero();
    }

    @Test
    void advanced_aboveMaxEdge_isDownscaledAndFlagged() {
        settings.setAdvancedMaxEdge(160);
        ResolutionPipeline pipeline = pipeline(new FakeSegmentationModel("primary"), new FakeSegmentationModel("fallback"));

        ProcessingResult result = pipeline.process(JobRequest.advanced(TestImages.noise(320, 320, 6),
                AnvilSpec.defaults(BLUE, AspectRatio.SQUARE_1_1), Style.GRADIENT, ExportFormat.IMAGE, "sq"));

        assertThat(result.autoDownscaled()).isTrue();
        assertThat(result.width()).isEqualTo(160);
        assertThat(result.height()).isEqualTo(160);
    }

    @Test
    void advanced_layers_flattenBackToComposite() {
        ResolutionPipeline pipeline = pipeline(new FakeSegmentationModel("primary").alpha(180),
                new FakeSegmentationModel("fallback"));
        BufferedImage photo = TestImages.noise(320, 180, 8);

        ProcessingResult result = pipeline.process(JobRequest.advanced(photo,
                AnvilSpec.defaults(BLUE, AspectRatio.LANDSCAPE_16_9), Style.GRADIENT_SILHOUETTE,
                ExportFormat.LAYERS, "portrait"));

        LayerPackage layers = result.layerPackage();
        assertThat(layers).isNotNull();
        assertThat(layers.layers()).hasSize(4);
        assertThat(layers.metadata().subjectModel()).isEqualTo(ModelUsed.PRIMARY);
        assertThat(result.packageName(Style.GRADIENT_SILHOUETTE))
                .isEqualTo("portrait_gradientsilhouette_Blue2_layers.zip");

        int[] flattened = TestImages.pixels(exporter.flatten(layers));
        int[] composite = TestImages.pixels(ImageCodec.readPng(result.styles().get(0).imageBytes()));
        assertThat(flattened).hasSameSizeAs(composite);
        for (int i = 0; i < composite.length; i++) {
            assertThat(Math.abs(TestImages.red(flattened[i]) - TestImages.red(composite[i]))).isLessThanOrEqualTo(1);
            assertThat(Math.abs(TestImages.green(flattened[i]) - TestImages.green(composite[i]))).isLessThanOrEqualTo(1);
            assertThat(Math.abs(TestImages.blue(flattened[i]) - TestImages.blue(composite[i]))).isLessThanOrEqualTo(1);
            assertThat(Math.abs(TestImages.alpha(flattened[i]) - TestImages.alpha(composite[i]))).isLessThanOrEqualTo(1);
        }
    }

    @Test
    void advanced_silhouette_withBothModelsDown_returnsPhotoUnchanged() {
        ResolutionPipeline pipeline = pipeline(new FakeSegmentationModel("primary").failingLoad(),
                new FakeSegmentationModel("fallback").failingPredict());
        BufferedImage photo = TestImages.noise(320, 180, 10);

        ProcessingResult result = pipeline.process(JobRequest.advanced(photo,
                AnvilSpec.defaults(BLUE, AspectRatio.LANDSCAPE_16_9), Style.SILHOUETTE, ExportFormat.IMAGE, "p"));

        assertThat(result.modelUsed()).isEqualTo(ModelUsed.DEGRADED);
        BufferedImage out = ImageCodec.readPng(result.styles().get(0).imageBytes());
        assertThat(TestImages.pixels(out)).isEqualTo(TestImages.pixels(photo));
    }

    @Test
    void process_extractionOverBudget_timesOut() {
        ResolutionPipeline pipeline = pipeline(new FakeSegmentationModel("primary").slowPredict(10_000),
                new FakeSegmentationModel("fallback"), Duration.ofSeconds(30), Duration.ofMillis(200));

        assertThatThrownBy(() -> pipeline.process(JobRequest.advanced(TestImages.noise(320, 180, 12),
                AnvilSpec.defaults(BLUE, AspectRatio.LANDSCAPE_16_9), Style.SILHOUETTE, ExportFormat.IMAGE, "p")))
                .isInstanceOf(ProcessingTimeoutException.class)
                .hasMessageContaining("Subject extraction");
    }

    @Test
    void admit_rejectsTinyImages() {
        ResolutionPipeline pipeline = pipeline(new FakeSegmentationModel("primary"), new FakeSegmentationModel("fallback"));
        JobRequest request = JobRequest.preview(TestImages.noise(10, 10, 1),
                AnvilSpec.defaults(BLUE, AspectRatio.SQUARE_1_1), "tiny");

        assertThatThrownBy(() -> pipeline.admit(request)).isInstanceOf(SpecValidationException.class);
    }

    @Test
    void admit_rejectsUploadsWithAnEdgeAboveTheDimensionLimit() {
        ResolutionPipeline pipeline = pipeline(new FakeSegmentationModel("primary"), new FakeSegmentationModel("fallback"));
        JobRequest request = JobRequest.advanced(new BufferedImage(8193, 64, BufferedImage.TYPE_BYTE_BINARY),
                AnvilSpec.defaults(BLUE, AspectRatio.LANDSCAPE_16_9), Style.FLAT, ExportFormat.IMAGE, "wide");

        assertThatThrownBy(() -> pipeline.admit(request))
                .isInstanceOf(ResourceExhaustionException.class)
                .hasMessageContaining("8192");
    }

    @Test
    void admit_rejectsUploadsAbovePixelBudgetBeforeDownscale() {
        ResolutionPipeline pipeline = pipeline(new FakeSegmentationModel("primary"), new FakeSegmentationModel("fallback"));
        // 8000x7000 = 56M pixels; fitted to the 8K edge it would be well under the budget
        JobRequest request = JobRequest.advanced(new BufferedImage(8000, 7000, BufferedImage.TYPE_BYTE_BINARY),
                AnvilSpec.defaults(BLUE, AspectRatio.SQUARE_1_1), Style.FLAT, ExportFormat.IMAGE, "huge");

        assertThatThrownBy(() -> pipeline.admit(request))
                .isInstanceOf(ResourceExhaustionException.class)
                .hasMessageContaining("50000000");
    }

    @Test
    void admit_acceptsUploadsAtTheLimits() {
        ResolutionPipeline pipeline = pipeline(new FakeSegmentationModel("primary"), new FakeSegmentationModel("fallback"));
        JobRequest request = JobRequest.advanced(new BufferedImage(8192, 6000, BufferedImage.TYPE_BYTE_BINARY),
                AnvilSpec.defaults(BLUE, AspectRatio.LANDSCAPE_16_9), Style.FLAT, ExportFormat.IMAGE, "edge");

        pipeline.admit(request);
    }
}
