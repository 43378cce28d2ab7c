package com.project.image.anvil.service;

import com.project.image.anvil.DTOs.AnvilPolygon;
import com.project.image.anvil.DTOs.AnvilSpec;
import com.project.image.anvil.DTOs.ShapeGeometry;
import com.project.image.anvil.DTOs.ShapeMask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Places the anvil on a canvas and rasterizes it. Pure: the same canvas and spec always
 * produce the same mask.
 */
public class ShapeEngine {
    private static final Logger log = LoggerFactory.getLogger(ShapeEngine.class);

    private final AnvilPolygon polygon;

    public ShapeEngine(AnvilPolygon polygon) {
        this.polygon = polygon;
    }

    public ShapeMask computeShapeMask(int width, int height, AnvilSpec spec) {
        ShapeGeometry geometry = place(width, height, spec);
        byte[] data = new byte[width * height];

        int y0 = Math.max(0, (int) Math.floor(geometry.top()));
        int y1 = Math.min(height, (int) Math.ceil(geometry.bottom()));
        int x0 = Math.max(0, (int) Math.floor(geometry.left()));
        int x1 = Math.min(width, (int) Math.ceil(geometry.right()));
        for (int y = y0; y < y1; y++) {
            int row = y * width;
            double cy = y + 0.5;
            for (int x = x0; x < x1; x++) {
                if (geometry.contains(x + 0.5, cy)) {
                    data[row + x] = 1;
                }
            }
        }
        log.debug("Anvil mask {}x{}: box=({}, {}) {}x{}", width, height,
                geometry.left(), geometry.top(), geometry.width(), geometry.height());
        return new ShapeMask(width, height, data, geometry);
    }

    /**
     * Sizes the 2:1 box against the limiting canvas dimension, centers it, then moves it
     * by the offsets within the remaining slack. The box is clamped to the canvas.
     */
    public ShapeGeometry place(int width, int height, AnvilSpec spec) {
        double limiting = Math.min(width, 2.0 * height);
        double shapeWidth = Math.max(1.0, Math.min(width, spec.scale() * limiting));
        double shapeHeight = Math.max(1.0, Math.min(height, shapeWidth / 2.0));

        double slackX = (width - shapeWidth) / 2.0;
        double slackY = (height - shapeHeight) / 2.0;
        double left = clamp(slackX + spec.offsetX() * slackX, 0.0, width - shapeWidth);
        double top = clamp(slackY + spec.offsetY() * slackY, 0.0, height - shapeHeight);

        double[] xs = new double[polygon.size()];
        double[] ys = new double[polygon.size()];
        for (int i = 0; i < polygon.size(); i++) {
            xs[i] = left + polygon.x(i) * shapeWidth;
            ys[i] = top + polygon.y(i) * shapeHeight;
        }
        return new ShapeGeometry(left, top, shapeWidth, shapeHeight, xs, ys);
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }
}
