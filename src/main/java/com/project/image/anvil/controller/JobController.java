package com.project.image.anvil.controller;

import com.project.image.anvil.DTOs.AnvilSpec;
import com.project.image.anvil.DTOs.AspectRatio;
import com.project.image.anvil.DTOs.CancelOutcome;
import com.project.image.anvil.DTOs.ExportFormat;
import com.project.image.anvil.DTOs.JobRequest;
import com.project.image.anvil.DTOs.JobSnapshot;
import com.project.image.anvil.DTOs.JobStatus;
import com.project.image.anvil.DTOs.JobStatusResponse;
import com.project.image.anvil.DTOs.ProcessingResult;
import com.project.image.anvil.DTOs.RgbColor;
import com.project.image.anvil.DTOs.SchedulerStats;
import com.project.image.anvil.DTOs.Style;
import com.project.image.anvil.DTOs.StyleResult;
import com.project.image.anvil.exceptions.JobNotFoundException;
import com.project.image.anvil.exceptions.JobNotReadyException;
import com.project.image.anvil.exceptions.SpecValidationException;
import com.project.image.anvil.service.ColorPalette;
import com.project.image.anvil.service.JobScheduler;
import com.project.image.anvil.service.LayerExporter;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP front of the scheduler. Uploads are decoded and validated here; all pixel work
 * happens on the scheduler's workers.
 */
@RestController
@RequestMapping("/api")
@Validated
public class JobController {
    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final MediaType ZIP = MediaType.parseMediaType("application/zip");

    private final JobScheduler scheduler;
    private final LayerExporter layerExporter;

    public JobController(JobScheduler scheduler, LayerExporter layerExporter) {
        this.scheduler = scheduler;
        this.layerExporter = layerExporter;
    }

    @PostMapping(value = "/jobs/preview", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, String>> submitPreview(
            @RequestParam("file") @NotNull MultipartFile file,
            @RequestParam(name = "ratio", defaultValue = "16:9") String ratio,
            @RequestParam(name = "color", defaultValue = "#0070F2") String color,
            @RequestParam(name = "opacity", defaultValue = "0.5") double opacity,
            @RequestParam(name = "scale", defaultValue = "0.7") double scale,
            @RequestParam(name = "offsetX", defaultValue = "0") double offsetX,
            @RequestParam(name = "offsetY", defaultValue = "0") double offsetY
    ) throws IOException {
        AnvilSpec spec = new AnvilSpec(scale, offsetX, offsetY, RgbColor.fromHex(color), opacity,
                AspectRatio.fromLabel(ratio));
        BufferedImage image = decode(file);

        String jobId = scheduler.submit(JobRequest.preview(image, spec, baseName(file.getOriginalFilename())));
        log.info("Accepted preview job {} for {} ({}x{})", jobId, file.getOriginalFilename(),
                image.getWidth(), image.getHeight());
        return accepted(jobId);
    }

    @PostMapping(value = "/jobs/advanced", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, String>> submitAdvanced(
            @RequestParam("file") @NotNull MultipartFile file,
            @RequestParam("style") String style,
            @RequestParam(name = "format", required = false) String format,
            @RequestParam(name = "ratio", defaultValue = "16:9") String ratio,
            @RequestParam(name = "color", defaultValue = "#0070F2") String color,
            @RequestParam(name = "opacity", defaultValue = "0.5") double opacity,
            @RequestParam(name = "scale", defaultValue = "0.7") double scale,
            @RequestParam(name = "offsetX", defaultValue = "0") double offsetX,
            @RequestParam(name = "offsetY", defaultValue = "0") double offsetY
    ) throws IOException {
        Style parsedStyle = Style.parse(style);
        ExportFormat exportFormat = ExportFormat.parse(format);
        AnvilSpec spec = new AnvilSpec(scale, offsetX, offsetY, RgbColor.fromHex(color), opacity,
                AspectRatio.fromLabel(ratio));
        BufferedImage image = decode(file);

        String jobId = scheduler.submit(JobRequest.advanced(image, spec, parsedStyle, exportFormat,
                baseName(file.getOriginalFilename())));
        log.info("Accepted advanced job {} for {}: style={}, format={}", jobId, file.getOriginalFilename(),
                parsedStyle.displayName(), exportFormat);
        return accepted(jobId);
    }

    @GetMapping("/jobs/{jobId}")
    public JobStatusResponse status(@PathVariable String jobId) {
        return JobStatusResponse.from(find(jobId));
    }

    @GetMapping("/jobs/{jobId}/styles/{style}")
    public ResponseEntity<byte[]> downloadStyle(@PathVariable String jobId, @PathVariable String style) {
        Style requested = Style.parse(style);
        ProcessingResult result = finishedResult(jobId);
        StyleResult image = result.style(requested)
                .orElseThrow(() -> new JobNotFoundException(jobId + "/" + requested.slug()));
        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_PNG)
                .header(HttpHeaders.CONTENT_DISPOSITION, attachment(result.downloadName(requested)))
                .body(image.imageBytes());
    }

    @GetMapping("/jobs/{jobId}/package")
    public ResponseEntity<byte[]> downloadPackage(@PathVariable String jobId) {
        ProcessingResult result = finishedResult(jobId);
        if (result.layerPackage() == null) {
            throw new JobNotReadyException("Job " + jobId + " was not submitted with the layers format");
        }
        byte[] zip = layerExporter.toZip(result.layerPackage());
        return ResponseEntity.ok()
                .contentType(ZIP)
                .header(HttpHeaders.CONTENT_DISPOSITION, attachment(result.packageName(result.styles().get(0).style())))
                .body(zip);
    }

    @GetMapping("/jobs/{jobId}/archive")
    public ResponseEntity<byte[]> downloadAll(@PathVariable String jobId) {
        ProcessingResult result = finishedResult(jobId);
        return ResponseEntity.ok()
                .contentType(ZIP)
                .header(HttpHeaders.CONTENT_DISPOSITION, attachment(LayerExporter.ASSETS_FILE))
                .body(layerExporter.toAssetsZip(result));
    }

    /**
     * Cancels a queued or running job; for a finished job, releases its result.
     */
    @DeleteMapping("/jobs/{jobId}")
    public Map<String, String> cancel(@PathVariable String jobId) {
        CancelOutcome outcome = scheduler.cancel(jobId);
        if (outcome == CancelOutcome.NOT_FOUND) {
            throw new JobNotFoundException(jobId);
        }
        if (outcome == CancelOutcome.ALREADY_FINISHED) {
            scheduler.collect(jobId);
        }
        Map<String, String> body = new LinkedHashMap<>();
        body.put("jobId", jobId);
        body.put("outcome", outcome.name().toLowerCase(Locale.ROOT));
        return body;
    }

    @GetMapping("/jobs/stats")
    public SchedulerStats stats() {
        return scheduler.stats();
    }

    @GetMapping("/palette")
    public Map<String, String> palette() {
        return ColorPalette.colors();
    }

    private JobSnapshot find(String jobId) {
        return scheduler.status(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private ProcessingResult finishedResult(String jobId) {
        JobSnapshot snapshot = find(jobId);
        if (snapshot.status() == JobStatus.ERROR) {
            throw new JobNotReadyException("Job " + jobId + " failed: " + snapshot.errorDetail());
        }
        if (snapshot.status() != JobStatus.DONE) {
            throw new JobNotReadyException("Job " + jobId + " is still " + snapshot.status().name().toLowerCase(Locale.ROOT));
        }
        return snapshot.result();
    }

    private BufferedImage decode(MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new SpecValidationException("Please choose a file to upload");
        }
        BufferedImage image;
        try (var inputStream = file.getInputStream()) {
            image = ImageIO.read(inputStream);
        }
        if (image == null) {
            throw new SpecValidationException("The file is not a valid image or is corrupted.");
        }
        log.debug("Image loaded successfully: {}x{}", image.getWidth(), image.getHeight());
        return image;
    }

    /** File stem reduced to a safe character set, e.g. {@code My Photo.JPG -> My_Photo}. */
    static String baseName(String originalFilename) {
        if (originalFilename == null || originalFilename.isBlank()) {
            return "image";
        }
        String name = originalFilename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        name = name.replaceAll("[^A-Za-z0-9_-]+", "_");
        return name.isBlank() || name.equals("_") ? "image" : name;
    }

    private static String attachment(String fileName) {
        return ContentDisposition.attachment().filename(fileName).build().toString();
    }

    private static ResponseEntity<Map<String, String>> accepted(String jobId) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("jobId", jobId);
        body.put("statusUrl", "/api/jobs/" + jobId);
        return ResponseEntity.accepted().body(body);
    }
}
