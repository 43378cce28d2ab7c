package com.project.image.anvil.DTOs;

import java.awt.Rectangle;

/**
 * Binary raster of the anvil: 1 inside the polygon, 0 outside, row-major.
 */
public record ShapeMask(int width, int height, byte[] data, ShapeGeometry geometry) {

    public boolean isInside(int x, int y) {
        return data[y * width + x] != 0;
    }

    public boolean isInside(int index) {
        return data[index] != 0;
    }

    /** Tight pixel bounds of the set pixels, or {@code null} for an empty mask. */
    public Rectangle pixelBounds() {
        int minX = width, minY = height, maxX = -1, maxY = -1;
        for (int y = 0; y < height; y++) {
            int row = y * width;
            for (int x = 0; x < width; x++) {
                if (data[row + x] != 0) {
                    if (x < minX) minX = x;
                    if (x > maxX) maxX = x;
                    if (y < minY) minY = y;
                    if (y > maxY) maxY = y;
                }
            }
        }
        return maxX < 0 ? null : new Rectangle(minX, minY, maxX - minX + 1, maxY - minY + 1);
    }
}
