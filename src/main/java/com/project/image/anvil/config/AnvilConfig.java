package com.project.image.anvil.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.image.anvil.DTOs.AnvilPolygon;
import com.project.image.anvil.service.GradientPalette;
import com.project.image.anvil.service.JobScheduler;
import com.project.image.anvil.service.LayerExporter;
import com.project.image.anvil.service.ResolutionPipeline;
import com.project.image.anvil.service.ShapeEngine;
import com.project.image.anvil.service.StepRunner;
import com.project.image.anvil.service.StyleCompositor;
import com.project.image.anvil.service.SubjectExtractor;
import com.project.image.anvil.service.segmentation.GrabCutSegmentationModel;
import com.project.image.anvil.service.segmentation.OnnxSegmentationModel;
import com.project.image.anvil.service.segmentation.SegmentationModels;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the processing components. Everything is built from {@link AnvilProperties} so a
 * bad shape or palette fails the context at startup instead of the first job.
 */
@Configuration
@EnableConfigurationProperties(AnvilProperties.class)
public class AnvilConfig {

    // primary attempt, fallback attempt, and slack for mask upscaling
    private static final int EXTRACTION_BUDGET_FACTOR = 3;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ShapeEngine shapeEngine(AnvilProperties props) {
        return new ShapeEngine(AnvilPolygon.parse(props.getShape().getVertices()));
    }

    @Bean
    public StyleCompositor styleCompositor(AnvilProperties props) {
        GradientPalette palette = new GradientPalette(props.getGradient().getTones());
        return new StyleCompositor(palette, props.getStyle().getStrokeFraction());
    }

    @Bean(destroyMethod = "close")
    public SegmentationModels segmentationModels(AnvilProperties props) {
        AnvilProperties.Segmentation seg = props.getSegmentation();
        return new SegmentationModels(
                new OnnxSegmentationModel(Path.of(seg.getPrimaryModelPath()), seg.getPrimaryInputSize()),
                new GrabCutSegmentationModel(seg.getGrabCutIterations(), seg.getGrabCutWorkingEdge()));
    }

    @Bean
    public SubjectExtractor subjectExtractor(SegmentationModels models, AnvilProperties props) {
        return new SubjectExtractor(models, props.getSegmentation().getExtractionTimeout());
    }

    @Bean(destroyMethod = "close")
    public StepRunner stepRunner() {
        return new StepRunner();
    }

    @Bean
    public LayerExporter layerExporter(StyleCompositor compositor, ObjectMapper objectMapper, Clock clock) {
        return new LayerExporter(compositor, objectMapper, clock);
    }

    @Bean
    public ResolutionPipeline resolutionPipeline(ShapeEngine shapeEngine, SubjectExtractor subjectExtractor,
                                                 StyleCompositor compositor, LayerExporter layerExporter,
                                                 StepRunner stepRunner, AnvilProperties props) {
        return new ResolutionPipeline(shapeEngine, subjectExtractor, compositor, layerExporter, stepRunner,
                props.getPipeline(),
                props.getSegmentation().getExtractionTimeout().multipliedBy(EXTRACTION_BUDGET_FACTOR));
    }

    @Bean
    public JobScheduler jobScheduler(AnvilProperties props, ResolutionPipeline pipeline, Clock clock) {
        return new JobScheduler(props.getScheduler(), pipeline, clock);
    }

    @Bean
    public JobSchedulerLifecycle jobSchedulerLifecycle(JobScheduler scheduler) {
        return new JobSchedulerLifecycle(scheduler);
    }
}
