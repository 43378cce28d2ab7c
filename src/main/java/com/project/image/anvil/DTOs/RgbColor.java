package com.project.image.anvil.DTOs;

import com.project.image.anvil.exceptions.SpecValidationException;

import java.util.Locale;
import java.util.regex.Pattern;

/** Opaque sRGB colour, 8 bits per channel. */
public record RgbColor(int red, int green, int blue) {

    private static final Pattern HEX = Pattern.compile("#?[0-9a-fA-F]{6}");

    public RgbColor {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
    }

    public static RgbColor fromHex(String hex) {
        if (hex == null || !HEX.matcher(hex.trim()).matches()) {
            throw new SpecValidationException("Invalid colour, expected #RRGGBB: " + hex);
        }
        String digits = hex.trim();
        if (digits.startsWith("#")) {
            digits = digits.substring(1);
        }
        int rgb = Integer.parseInt(digits, 16);
        return new RgbColor((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
    }

    public String toHex() {
        return String.format(Locale.ROOT, "#%02X%02X%02X", red, green, blue);
    }

    /** Packed opaque ARGB. */
    public int argb() {
        return 0xFF000000 | (red << 16) | (green << 8) | blue;
    }

    /**
     * Tonal variant: positive amounts mix toward white, negative toward black.
     */
    public RgbColor tone(double amount) {
        double a = Math.max(-1.0, Math.min(1.0, amount));
        if (a >= 0) {
            return new RgbColor(
                    (int) (red + (255 - red) * a),
                    (int) (green + (255 - green) * a),
                    (int) (blue + (255 - blue) * a));
        }
        double keep = 1.0 + a;
        return new RgbColor((int) (red * keep), (int) (green * keep), (int) (blue * keep));
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new SpecValidationException("Colour channel " + name + " out of range: " + value);
        }
    }
}
