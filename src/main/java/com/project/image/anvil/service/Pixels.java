package com.project.image.anvil.service;

import com.project.image.anvil.exceptions.CompositeFailureException;

/**
 * Straight-alpha ARGB arithmetic. All operations are integer and exactly reproducible.
 */
public final class Pixels {

    private Pixels() {
    }

    public static int alpha(int argb) {
        return argb >>> 24;
    }

    public static int red(int argb) {
        return (argb >> 16) & 0xFF;
    }

    public static int green(int argb) {
        return (argb >> 8) & 0xFF;
    }

    public static int blue(int argb) {
        return argb & 0xFF;
    }

    public static int argb(int a, int r, int g, int b) {
        return (a << 24) | (r << 16) | (g << 8) | b;
    }

    public static int withAlpha(int argb, int a) {
        return a == 0 ? 0 : (a << 24) | (argb & 0x00FFFFFF);
    }

    /** Porter-Duff source-over. */
    public static int over(int src, int dst) {
        int sa = alpha(src);
        if (sa == 255) {
            return src;
        }
        if (sa == 0) {
            return dst;
        }
        int da = alpha(dst);
        int dw = da * (255 - sa);
        int den = sa * 255 + dw;
        if (den == 0) {
            return 0;
        }
        int sw = sa * 255;
        int half = den / 2;
        int r = (red(src) * sw + red(dst) * dw + half) / den;
        int g = (green(src) * sw + green(dst) * dw + half) / den;
        int b = (blue(src) * sw + blue(dst) * dw + half) / den;
        int a = (den + 127) / 255;
        return argb(a, r, g, b);
    }

    /** Porter-Duff destination-in: keeps {@code dst} colour, scales its alpha by the mask's. */
    public static int destinationIn(int mask, int dst) {
        int a = (alpha(dst) * alpha(mask) + 127) / 255;
        return withAlpha(dst, a);
    }

    public static int lerp(int from, int to, double t) {
        return (int) Math.round(from + (to - from) * t);
    }

    /** Pixel loops call this once per row so a cancelled step stops promptly. */
    static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CompositeFailureException("Compositing interrupted");
        }
    }
}
