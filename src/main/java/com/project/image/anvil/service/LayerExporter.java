package com.project.image.anvil.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.image.anvil.DTOs.AnvilSpec;
import com.project.image.anvil.DTOs.BlendMode;
import com.project.image.anvil.DTOs.LayerMetadata;
import com.project.image.anvil.DTOs.LayerPackage;
import com.project.image.anvil.DTOs.ProcessingResult;
import com.project.image.anvil.DTOs.Style;
import com.project.image.anvil.DTOs.StyleResult;
import com.project.image.anvil.DTOs.SubjectMask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Assembles the editable layer package of an advanced job. No new pixel work: the layers
 * are the pipeline's intermediates, encoded as PNG.
 */
public class LayerExporter {
    private static final Logger log = LoggerFactory.getLogger(LayerExporter.class);

    public static final String BACKGROUND_FILE = "01_background.png";
    public static final String SUBJECT_FILE = "02_subject_cutout.png";
    public static final String SHAPE_FILE = "03_anvil_shape.png";
    public static final String COMPOSITE_FILE = "final_composite.png";
    public static final String METADATA_FILE = "layer_info.json";
    public static final String README_FILE = "README.txt";
    public static final String ASSETS_FILE = "anvil_assets.zip";

    private static final String FORMAT_VERSION = "1.0";

    private final StyleCompositor compositor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public LayerExporter(StyleCompositor compositor, ObjectMapper objectMapper, Clock clock) {
        this.compositor = compositor;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException when the inputs do not share pixel dimensions
     */
    public LayerPackage buildPackage(BufferedImage baseImage, SubjectMask subjectMask,
                                     StyleCompositor.Overlay shapeOverlay, BufferedImage compositeImage,
                                     AnvilSpec spec, Style style) {
        int w = baseImage.getWidth(), h = baseImage.getHeight();
        requireSameSize("subject mask", subjectMask.width(), subjectMask.height(), w, h);
        requireSameSize("anvil overlay", shapeOverlay.image().getWidth(), shapeOverlay.image().getHeight(), w, h);
        requireSameSize("composite", compositeImage.getWidth(), compositeImage.getHeight(), w, h);

        String colorName = ColorPalette.nameOf(spec.color());
        List<LayerPackage.Layer> stack = new ArrayList<>();
        stack.add(new LayerPackage.Layer("Background", BACKGROUND_FILE, BlendMode.NORMAL,
                ImageCodec.toPng(baseImage), "Original cropped image at full resolution"));
        stack.add(new LayerPackage.Layer("Subject Cutout", SUBJECT_FILE, BlendMode.NORMAL,
                ImageCodec.toPng(compositor.subjectCutout(baseImage, subjectMask)),
                "Extracted subject with transparency"));
        stack.add(new LayerPackage.Layer("Anvil Shape", SHAPE_FILE, shapeOverlay.blendMode(),
                ImageCodec.toPng(shapeOverlay.image()),
                shapeDescription(style, colorName, spec, shapeOverlay.blendMode())));
        LayerPackage.Layer composite = new LayerPackage.Layer("Final Composite", COMPOSITE_FILE, BlendMode.NORMAL,
                ImageCodec.toPng(compositeImage), "Ready-to-use flattened result");

        List<LayerMetadata.Entry> entries = stack.stream()
                .map(l -> new LayerMetadata.Entry(l.name(), l.fileName(), l.blendMode(), l.description()))
                .toList();
        LayerMetadata metadata = new LayerMetadata(FORMAT_VERSION, style, colorName, spec.color().toHex(),
                spec.opacity(), spec.scale(), spec.offsetX(), spec.offsetY(), spec.aspectRatio(),
                w, h, subjectMask.modelUsed(), clock.instant().toString(), entries, COMPOSITE_FILE);

        log.info("Built {} layer package {}x{} (subject: {})", style.displayName(), w, h, subjectMask.modelUsed());
        return new LayerPackage(stack, composite, metadata);
    }

    public void writeZip(LayerPackage layerPackage, OutputStream out) throws IOException {
        ZipOutputStream zip = new ZipOutputStream(out);
        for (LayerPackage.Layer layer : layerPackage.layers()) {
            putEntry(zip, layer.fileName(), layer.png());
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("anvil_export", layerPackage.metadata());
        putEntry(zip, METADATA_FILE, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document));
        putEntry(zip, README_FILE, readme(layerPackage.metadata()).getBytes(StandardCharsets.UTF_8));
        zip.finish();
    }

    public byte[] toZip(LayerPackage layerPackage) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            writeZip(layerPackage, baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write layer package", e);
        }
    }

    /** All rendered styles of a job under their download names. */
    public byte[] toAssetsZip(ProcessingResult result) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             ZipOutputStream zip = new ZipOutputStream(baos)) {
            for (StyleResult style : result.styles()) {
                putEntry(zip, result.downloadName(style.style()), style.imageBytes());
            }
            zip.finish();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write assets archive", e);
        }
    }

    /** Re-stacks background, cutout and anvil layer with their blend modes. */
    public BufferedImage flatten(LayerPackage layerPackage) {
        List<LayerPackage.Layer> stack = layerPackage.stack();
        BufferedImage background = ImageCodec.readPng(stack.get(0).png());
        BufferedImage cutout = ImageCodec.readPng(stack.get(1).png());
        LayerPackage.Layer shape = stack.get(2);
        return StyleCompositor.stack(background, cutout, ImageCodec.readPng(shape.png()), shape.blendMode());
    }

    String readme(LayerMetadata metadata) {
        return """
                ANVIL LAYER PACKAGE
                ===================

                Style: %s
                Color: %s (%s)
                Resolution: %s
                Subject extraction: %s

                FILES
                -----
                %s - original image background
                %s - extracted subject
                %s - anvil layer (blend mode: %s)
                %s - final flattened result
                %s - technical metadata

                USAGE
                -----
                1. Create a new document at %s in any layer-capable editor.
                2. Import the layers bottom to top: background, subject cutout, anvil.
                3. If the anvil blend mode is "mask", use that layer as a clipping mask.
                4. Each PNG keeps its transparency (sRGB, 8 bits per channel).
                """.formatted(
                metadata.style().displayName(), metadata.colorName(), metadata.colorHex(),
                metadata.resolution(), metadata.subjectModel().name().toLowerCase(Locale.ROOT),
                BACKGROUND_FILE, SUBJECT_FILE, SHAPE_FILE, metadata.layers().get(2).blendMode().jsonName(),
                COMPOSITE_FILE, METADATA_FILE, metadata.resolution());
    }

    private static String shapeDescription(Style style, String colorName, AnvilSpec spec, BlendMode mode) {
        String base = style.displayName() + " anvil layer in " + colorName + " (" + spec.color().toHex() + ")";
        return mode == BlendMode.MASK ? base + ", apply as clipping mask" : base;
    }

    private static void putEntry(ZipOutputStream zip, String name, byte[] data) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        zip.write(data);
        zip.closeEntry();
    }

    private static void requireSameSize(String what, int w, int h, int expectedW, int expectedH) {
        if (w != expectedW || h != expectedH) {
            throw new IllegalArgumentException("Layer " + what + " is " + w + "x" + h + ", expected " + expectedW + "x" + expectedH);
        }
    }
}
