package com.project.image.anvil.service;

import com.project.image.anvil.DTOs.JobKind;
import com.project.image.anvil.DTOs.JobRequest;
import com.project.image.anvil.DTOs.LayerPackage;
import com.project.image.anvil.DTOs.ModelUsed;
import com.project.image.anvil.DTOs.ProcessingResult;
import com.project.image.anvil.DTOs.ShapeMask;
import com.project.image.anvil.DTOs.Style;
import com.project.image.anvil.DTOs.StyleResult;
import com.project.image.anvil.DTOs.SubjectMask;
import com.project.image.anvil.config.AnvilProperties;
import com.project.image.anvil.exceptions.ResourceExhaustionException;
import com.project.image.anvil.exceptions.SpecValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a job at the right resolution.
 *
 * <p>Preview: crop, shrink to the preview edge, extract the subject once and render all
 * six styles one after another, encoding each before the next starts so at most one
 * style raster is alive. Advanced: crop at native resolution (shrunk only above the
 * 8K edge), extract only when needed, render one style, optionally package layers.
 */
public class ResolutionPipeline implements JobProcessor {
    private static final Logger log = LoggerFactory.getLogger(ResolutionPipeline.class);

    private final ShapeEngine shapeEngine;
    private final SubjectExtractor subjectExtractor;
    private final StyleCompositor compositor;
    private final LayerExporter layerExporter;
    private final StepRunner stepRunner;
    private final AnvilProperties.Pipeline settings;
    private final Duration extractionBudget;

    /**
     * @param extractionBudget backstop for the whole extraction step, covering both models
     */
    public ResolutionPipeline(ShapeEngine shapeEngine, SubjectExtractor subjectExtractor, StyleCompositor compositor,
                              LayerExporter layerExporter, StepRunner stepRunner,
                              AnvilProperties.Pipeline settings, Duration extractionBudget) {
        this.shapeEngine = shapeEngine;
        this.subjectExtractor = subjectExtractor;
        this.compositor = compositor;
        this.layerExporter = layerExporter;
        this.stepRunner = stepRunner;
        this.settings = settings;
        this.extractionBudget = extractionBudget;
    }

    @Override
    public void admit(JobRequest request) {
        BufferedImage image = request.image();
        if (image.getWidth() < settings.getMinEdge() || image.getHeight() < settings.getMinEdge()) {
            throw new SpecValidationException("Image is too small. Minimum size: "
                    + settings.getMinEdge() + "x" + settings.getMinEdge() + " pixels");
        }
        // limits apply to the raw upload, before crop and downscale
        if (image.getWidth() > settings.getMaxInputDimension() || image.getHeight() > settings.getMaxInputDimension()) {
            throw new ResourceExhaustionException("Image dimensions too large: " + image.getWidth() + "x"
                    + image.getHeight() + ". Maximum: " + settings.getMaxInputDimension() + "x"
                    + settings.getMaxInputDimension());
        }
        long pixels = (long) image.getWidth() * image.getHeight();
        if (pixels > settings.getMaxInputPixels()) {
            throw new ResourceExhaustionException("Image is too large to process: " + image.getWidth() + "x"
                    + image.getHeight() + " exceeds " + settings.getMaxInputPixels() + " pixels");
        }
    }

    @Override
    public ProcessingResult process(JobRequest request) {
        return request.kind() == JobKind.PREVIEW ? runPreview(request) : runAdvanced(request);
    }

    private ProcessingResult runPreview(JobRequest request) {
        BufferedImage base = ImageCodec.fitWithin(cropToRatio(request), settings.getPreviewMaxEdge());
        int w = base.getWidth(), h = base.getHeight();
        log.info("Preview pass at {}x{} for {} styles", w, h, request.styles().size());

        ShapeMask shape = shapeEngine.computeShapeMask(w, h, request.spec());
        SubjectMask subject = extract(base);

        List<StyleResult> results = new ArrayList<>(request.styles().size());
        for (Style style : request.styles()) {
            BufferedImage rendered = render(style, base, shape, subject, request);
            results.add(new StyleResult(style, ImageCodec.toPng(rendered), w, h));
        }
        return new ProcessingResult(JobKind.PREVIEW, results, null, subject.modelUsed(), false, w, h,
                request.baseName(), ColorPalette.slugOf(request.spec().color()));
    }

    private ProcessingResult runAdvanced(JobRequest request) {
        Style style = request.style();
        BufferedImage crop = cropToRatio(request);
        BufferedImage base = ImageCodec.fitWithin(crop, settings.getAdvancedMaxEdge());
        boolean autoDownscaled = base != crop;
        if (autoDownscaled) {
            log.info("Auto-downscaled {}x{} to {}x{} (max edge {})", crop.getWidth(), crop.getHeight(),
                    base.getWidth(), base.getHeight(), settings.getAdvancedMaxEdge());
        }
        crop = null; // release the native-size copy early
        int w = base.getWidth(), h = base.getHeight();
        log.info("Advanced pass at {}x{}: style={}, format={}", w, h, style.displayName(), request.exportFormat());

        ShapeMask shape = shapeEngine.computeShapeMask(w, h, request.spec());
        SubjectMask subject = style.needsSubject() || request.wantsLayers() ? extract(base) : null;
        ModelUsed modelUsed = subject == null ? null : subject.modelUsed();

        if (!request.wantsLayers()) {
            BufferedImage rendered = render(style, base, shape, subject, request);
            StyleResult result = new StyleResult(style, ImageCodec.toPng(rendered), w, h);
            return new ProcessingResult(JobKind.ADVANCED, List.of(result), null, modelUsed, autoDownscaled, w, h,
                    request.baseName(), ColorPalette.slugOf(request.spec().color()));
        }

        StyleCompositor.Overlay overlay = stepRunner.run(style.displayName() + " overlay",
                settings.getCompositeTimeout(), () -> compositor.overlay(style, w, h, shape, subject, request.spec()));
        BufferedImage composite = render(style, base, shape, subject, request);
        LayerPackage layers = stepRunner.run("Layer export", settings.getCompositeTimeout(),
                () -> layerExporter.buildPackage(base, subject, overlay, composite, request.spec(), style));
        StyleResult result = new StyleResult(style, layers.composite().png(), w, h);
        return new ProcessingResult(JobKind.ADVANCED, List.of(result), layers, modelUsed, autoDownscaled, w, h,
                request.baseName(), ColorPalette.slugOf(request.spec().color()));
    }

    private BufferedImage render(Style style, BufferedImage base, ShapeMask shape, SubjectMask subject, JobRequest request) {
        long start = System.nanoTime();
        BufferedImage rendered = stepRunner.run(style.displayName() + " composite", settings.getCompositeTimeout(),
                () -> compositor.composite(style, base, shape, subject, request.spec()));
        log.debug("{} rendered in {} ms", style.displayName(), (System.nanoTime() - start) / 1_000_000);
        return rendered;
    }

    private SubjectMask extract(BufferedImage base) {
        return stepRunner.run("Subject extraction", extractionBudget, () -> subjectExtractor.extractSubject(base));
    }

    private BufferedImage cropToRatio(JobRequest request) {
        BufferedImage image = request.image();
        Rectangle crop = request.spec().aspectRatio().centerCrop(image.getWidth(), image.getHeight());
        return ImageCodec.crop(image, crop);
    }
}
