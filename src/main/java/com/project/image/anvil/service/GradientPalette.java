package com.project.image.anvil.service;

import com.project.image.anvil.DTOs.RgbColor;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives gradient stops from the chosen colour. The tone list is configuration: each
 * entry is a mix amount, positive toward white and negative toward black.
 */
public class GradientPalette {

    private final List<Double> tones;

    public GradientPalette(List<Double> tones) {
        if (tones == null || tones.isEmpty()) {
            throw new IllegalArgumentException("Gradient needs at least one tone");
        }
        for (Double tone : tones) {
            if (tone == null || tone < -1.0 || tone > 1.0) {
                throw new IllegalArgumentException("Gradient tone outside [-1, 1]: " + tone);
            }
        }
        this.tones = List.copyOf(tones);
    }

    public List<RgbColor> stops(RgbColor base) {
        List<RgbColor> stops = new ArrayList<>(tones.size());
        for (double tone : tones) {
            stops.add(base.tone(tone));
        }
        return stops;
    }

    /**
     * Opaque colour per canvas column. Stops are spread evenly from {@code start} to
     * {@code start + length}; columns outside that span take the end stop.
     */
    public int[] horizontalRamp(RgbColor base, double start, double length, int canvasWidth) {
        List<RgbColor> stops = stops(base);
        int[] ramp = new int[canvasWidth];
        int segments = stops.size() - 1;
        for (int x = 0; x < canvasWidth; x++) {
            if (segments == 0) {
                ramp[x] = stops.get(0).argb();
                continue;
            }
            double t = length <= 0 ? 0 : (x + 0.5 - start) / length;
            t = Math.max(0.0, Math.min(1.0, t));
            double position = t * segments;
            int i = Math.min(segments - 1, (int) position);
            double local = position - i;
            RgbColor a = stops.get(i);
            RgbColor b = stops.get(i + 1);
            ramp[x] = Pixels.argb(255,
                    Pixels.lerp(a.red(), b.red(), local),
                    Pixels.lerp(a.green(), b.green(), local),
                    Pixels.lerp(a.blue(), b.blue(), local));
        }
        return ramp;
    }
}
