package com.framegate.infrastructure.imaging;

import com.framegate.domain.frame.exception.ConfigException;

/**
 * RGB helpers for {@code 0xRRGGBB} colours.
 */
public final class ColorMath {

    private ColorMath() {
    }

    public static double distance(int rgbA, int rgbB) {
        int dr = ((rgbA >> 16) & 0xFF) - ((rgbB >> 16) & 0xFF);
        int dg = ((rgbA >> 8) & 0xFF) - ((rgbB >> 8) & 0xFF);
        int db = (rgbA & 0xFF) - (rgbB & 0xFF);
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }

    public static int parseHex(String hex) {
        String value = hex == null ? "" : hex.trim();
        if (value.startsWith("#")) {
            value = value.substring(1);
        }
        if (!value.matches("[0-9a-fA-F]{6}")) {
            throw new ConfigException("Invalid colour '" + hex + "', expected #RRGGBB");
        }
        return Integer.parseInt(value, 16);
    }

    public static String toHex(int rgb) {
        return String.format("#%06X", rgb & 0xFFFFFF);
    }
}
