package com.project.image.anvil.service;

import com.project.image.anvil.DTOs.AnvilSpec;
import com.project.image.anvil.DTOs.BlendMode;
import com.project.image.anvil.DTOs.ShapeGeometry;
import com.project.image.anvil.DTOs.ShapeMask;
import com.project.image.anvil.DTOs.Style;
import com.project.image.anvil.DTOs.SubjectMask;
import com.project.image.anvil.exceptions.CompositeFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Renders the six anvil styles.
 *
 * <p>Every style is expressed as an overlay layer stacked on the base photo (with the
 * subject cutout in between for the silhouette styles). {@link #composite} is exactly that
 * stack, so a layer package built from the same overlay flattens back to the composite.
 */
public class StyleCompositor {
    private static final Logger log = LoggerFactory.getLogger(StyleCompositor.class);

    private final GradientPalette palette;
    private final double strokeFraction;

    public StyleCompositor(GradientPalette palette, double strokeFraction) {
        if (!(strokeFraction > 0 && strokeFraction < 0.5)) {
            throw new IllegalArgumentException("strokeFraction must be in (0, 0.5): " + strokeFraction);
        }
        this.palette = palette;
        this.strokeFraction = strokeFraction;
    }

    /** A style's overlay raster and how it combines with the layers beneath. */
    public record Overlay(BufferedImage image, BlendMode blendMode) {
    }

    public BufferedImage composite(Style style, BufferedImage base, ShapeMask shape, SubjectMask subject, AnvilSpec spec) {
        Overlay overlay = overlay(style, base.getWidth(), base.getHeight(), shape, subject, spec);
        BufferedImage cutout = style.needsSubject() ? subjectCutout(base, subject) : null;
        BufferedImage result = stack(base, cutout, overlay.image(), overlay.blendMode());
        log.debug("Composited {} at {}x{}", style.displayName(), base.getWidth(), base.getHeight());
        return result;
    }

    public Overlay overlay(Style style, int width, int height, ShapeMask shape, SubjectMask subject, AnvilSpec spec) {
        requireSize("Shape mask", shape.width(), shape.height(), width, height);
        if (style.needsSubject()) {
            if (subject == null) {
                throw new CompositeFailureException(style.displayName() + " needs a subject mask");
            }
            requireSize("Subject mask", subject.width(), subject.height(), width, height);
        }
        int[] out = switch (style) {
            case FLAT -> flatOverlay(shape, spec);
            case STROKE -> strokeOverlay(shape, spec);
            case GRADIENT -> gradientOverlay(shape, spec);
            case WINDOW -> windowMask(shape, spec);
            case SILHOUETTE -> silhouetteBackdrop(solidRamp(spec, width), width, height, subject);
            case GRADIENT_SILHOUETTE -> silhouetteBackdrop(
                    palette.horizontalRamp(spec.color(), shape.geometry().left(), shape.geometry().width(), width),
                    width, height, subject);
        };
        BlendMode mode = style == Style.WINDOW ? BlendMode.MASK : BlendMode.NORMAL;
        return new Overlay(ImageCodec.fromArgb(out, width, height), mode);
    }

    /** Base pixels carrying the subject mask as alpha; everything else transparent. */
    public BufferedImage subjectCutout(BufferedImage base, SubjectMask subject) {
        int w = base.getWidth(), h = base.getHeight();
        requireSize("Subject mask", subject.width(), subject.height(), w, h);
        int[] px = ImageCodec.readArgb(base);
        for (int y = 0; y < h; y++) {
            Pixels.checkInterrupted();
            int row = y * w;
            for (int x = 0; x < w; x++) {
                int i = row + x;
                int a = (Pixels.alpha(px[i]) * subject.alphaAt(i) + 127) / 255;
                px[i] = Pixels.withAlpha(px[i], a);
            }
        }
        return ImageCodec.fromArgb(px, w, h);
    }

    /**
     * Flattens base, optional cutout and overlay. The overlay is source-over for
     * {@link BlendMode#NORMAL} and destination-in for {@link BlendMode#MASK}.
     */
    public static BufferedImage stack(BufferedImage base, BufferedImage cutout, BufferedImage overlay, BlendMode mode) {
        int w = base.getWidth(), h = base.getHeight();
        int[] px = ImageCodec.readArgb(base);
        int[] cut = cutout == null ? null : ImageCodec.readArgb(cutout);
        int[] top = ImageCodec.readArgb(overlay);
        for (int y = 0; y < h; y++) {
            Pixels.checkInterrupted();
            int row = y * w;
            for (int x = 0; x < w; x++) {
                int i = row + x;
                int p = cut == null ? px[i] : Pixels.over(cut[i], px[i]);
                px[i] = mode == BlendMode.MASK ? Pixels.destinationIn(top[i], p) : Pixels.over(top[i], p);
            }
        }
        return ImageCodec.fromArgb(px, w, h);
    }

    int strokeWidth(ShapeGeometry geometry) {
        return Math.max(1, (int) Math.round(geometry.shorterSide() * strokeFraction));
    }

    private int[] flatOverlay(ShapeMask shape, AnvilSpec spec) {
        int fill = Pixels.withAlpha(spec.color().argb(), (int) Math.round(spec.opacity() * 255));
        int[] out = new int[shape.width() * shape.height()];
        for (int y = 0; y < shape.height(); y++) {
            Pixels.checkInterrupted();
            int row = y * shape.width();
            for (int x = 0; x < shape.width(); x++) {
                if (shape.isInside(row + x)) {
                    out[row + x] = fill;
                }
            }
        }
        return out;
    }

    private int[] strokeOverlay(ShapeMask shape, AnvilSpec spec) {
        int w = shape.width(), h = shape.height();
        ShapeGeometry g = shape.geometry();
        double half = strokeWidth(g) / 2.0;
        int color = spec.color().argb();
        int[] out = new int[w * h];

        int x0 = Math.max(0, (int) Math.floor(g.left() - half - 1));
        int x1 = Math.min(w, (int) Math.ceil(g.right() + half + 1));
        int y0 = Math.max(0, (int) Math.floor(g.top() - half - 1));
        int y1 = Math.min(h, (int) Math.ceil(g.bottom() + half + 1));
        for (int y = y0; y < y1; y++) {
            Pixels.checkInterrupted();
            int row = y * w;
            for (int x = x0; x < x1; x++) {
                if (g.distanceToBoundary(x + 0.5, y + 0.5) <= half) {
                    out[row + x] = color;
                }
            }
        }
        return out;
    }

    private int[] gradientOverlay(ShapeMask shape, AnvilSpec spec) {
        int w = shape.width(), h = shape.height();
        int[] ramp = palette.horizontalRamp(spec.color(), shape.geometry().left(), shape.geometry().width(), w);
        int[] out = new int[w * h];
        for (int y = 0; y < h; y++) {
            Pixels.checkInterrupted();
            int row = y * w;
            for (int x = 0; x < w; x++) {
                if (shape.isInside(row + x)) {
                    out[row + x] = ramp[x];
                }
            }
        }
        return out;
    }

    // Only the alpha matters when applied; the colour makes the layer readable in editors.
    private int[] windowMask(ShapeMask shape, AnvilSpec spec) {
        int color = spec.color().argb();
        int[] out = new int[shape.width() * shape.height()];
        for (int i = 0; i < out.length; i++) {
            if (shape.isInside(i)) {
                out[i] = color;
            }
        }
        return out;
    }

    /**
     * Background fill that shows wherever the subject does not: alpha is the inverse of
     * the subject mask. A fully opaque (degraded) mask leaves the photo untouched.
     */
    private int[] silhouetteBackdrop(int[] ramp, int w, int h, SubjectMask subject) {
        int[] out = new int[w * h];
        for (int y = 0; y < h; y++) {
            Pixels.checkInterrupted();
            int row = y * w;
            for (int x = 0; x < w; x++) {
                int i = row + x;
                out[i] = Pixels.withAlpha(ramp[x], 255 - subject.alphaAt(i));
            }
        }
        return out;
    }

    private static int[] solidRamp(AnvilSpec spec, int width) {
        int[] ramp = new int[width];
        Arrays.fill(ramp, spec.color().argb());
        return ramp;
    }

    private static void requireSize(String what, int w, int h, int expectedW, int expectedH) {
        if (w != expectedW || h != expectedH) {
            throw new CompositeFailureException(what + " is " + w + "x" + h + " but the image is " + expectedW + "x" + expectedH);
        }
    }
}
