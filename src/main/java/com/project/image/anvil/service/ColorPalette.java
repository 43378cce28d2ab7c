package com.project.image.anvil.service;

import com.project.image.anvil.DTOs.RgbColor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Brand colour names, used for metadata and download file names. */
public final class ColorPalette {

    public static final String CUSTOM = "Custom";
    public static final RgbColor DEFAULT_COLOR = RgbColor.fromHex("#0070F2");

    private static final Map<String, String> NAMES_BY_HEX = new LinkedHashMap<>();

    static {
        register("White", "#FFFFFF");
        register("Black", "#000000");
        register("Light Gray", "#EDEFF0");
        register("Light Blue 1", "#D1EFFF");
        register("Light Blue 2", "#AEDBFF");
        register("Light Blue 3", "#7FC7FF");
        register("Light Blue 4", "#4EAEFF");
        register("Blue 1", "#1E90FF");
        register("Blue 2", "#0070F2");
        register("Dark Blue", "#0057B8");
        register("Navy", "#00418A");
        register("Deep Blue", "#002C5C");
        register("Teal 1", "#7AD0C9");
        register("Teal 2", "#2FA7A0");
        register("Teal 3", "#0D7F7B");
        register("Light Green", "#8FD99B");
        register("Green 1", "#44B87B");
        register("Green 2", "#2B7C46");
        register("Cream", "#FFF2CC");
        register("Yellow", "#FFD97A");
        register("Orange 1", "#FFB300");
        register("Orange 2", "#E37D00");
        register("Brown", "#8A4B00");
        register("Red 1", "#7A0613");
        register("Red 2", "#AA0843");
        register("Pink 1", "#D66D9E");
        register("Pink 2", "#B94D85");
    }

    private ColorPalette() {
    }

    public static String nameOf(RgbColor color) {
        return NAMES_BY_HEX.getOrDefault(color.toHex(), CUSTOM);
    }

    /** Name without spaces, e.g. {@code Blue2}. */
    public static String slugOf(RgbColor color) {
        return nameOf(color).replace(" ", "");
    }

    /** Palette name to hex, in display order. */
    public static Map<String, String> colors() {
        Map<String, String> colors = new LinkedHashMap<>();
        NAMES_BY_HEX.forEach((hex, name) -> colors.put(name, hex));
        return Collections.unmodifiableMap(colors);
    }

    private static void register(String name, String hex) {
        NAMES_BY_HEX.put(hex, name);
    }
}
