package com.project.image.anvil.service;

import com.project.image.anvil.exceptions.CompositeFailureException;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.imageio.ImageIO;

/**
 * Raster plumbing: ARGB buffers, crop, resize and PNG encoding.
 */
public final class ImageCodec {

    private ImageCodec() {
    }

    public static int[] readArgb(BufferedImage image) {
        int w = image.getWidth(), h = image.getHeight();
        int[] argb = new int[w * h];
        image.getRGB(0, 0, w, h, argb, 0, w);
        return argb;
    }

    public static BufferedImage fromArgb(int[] argb, int width, int height) {
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        out.setRGB(0, 0, width, height, argb, 0, width);
        return out;
    }

    /** Copies a region into a fresh ARGB image. */
    public static BufferedImage crop(BufferedImage source, Rectangle region) {
        BufferedImage out = new BufferedImage(region.width, region.height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.drawImage(source, -region.x, -region.y, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    public static BufferedImage resize(BufferedImage source, int width, int height) {
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    /** Shrinks so the long edge is at most {@code maxEdge}; never enlarges. */
    public static BufferedImage fitWithin(BufferedImage source, int maxEdge) {
        int w = source.getWidth(), h = source.getHeight();
        if (Math.max(w, h) <= maxEdge) {
            return source;
        }
        int[] size = fittedSize(w, h, maxEdge);
        return resize(source, size[0], size[1]);
    }

    /** Dimensions after {@link #fitWithin}. */
    static int[] fittedSize(int width, int height, int maxEdge) {
        if (Math.max(width, height) <= maxEdge) {
            return new int[]{width, height};
        }
        double factor = (double) maxEdge / Math.max(width, height);
        return new int[]{
                Math.max(1, (int) Math.round(width * factor)),
                Math.max(1, (int) Math.round(height * factor))
        };
    }

    public static byte[] toPng(BufferedImage img) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(img, "png", baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new CompositeFailureException("Failed to encode image", e);
        }
    }

    public static BufferedImage readPng(byte[] png) {
        try {
            BufferedImage img = ImageIO.read(new ByteArrayInputStream(png));
            if (img == null) {
                throw new CompositeFailureException("Not a decodable image");
            }
            return img;
        } catch (IOException e) {
            throw new CompositeFailureException("Failed to decode image", e);
        }
    }
}
