package uk.gegc.lessondocs.features.document.application.layout;

import java.awt.Color;

public record RgbColor(int red, int green, int blue) {

    public static final RgbColor WHITE = new RgbColor(255, 255, 255);
    public static final RgbColor HEADER_TEXT = new RgbColor(33, 33, 33);
    public static final RgbColor BODY_TEXT = new RgbColor(68, 68, 68);
    public static final RgbColor SUBTITLE_TEXT = new RgbColor(117, 117, 117);
    public static final RgbColor ATTRIBUTION_TEXT = new RgbColor(150, 150, 150);

    public RgbColor {
        if (red < 0 || red > 255 || green < 0 || green > 255 || blue < 0 || blue > 255) {
            throw new IllegalArgumentException("Color components must be within 0..255");
        }
    }

    public static RgbColor of(int red, int green, int blue) {
        return new RgbColor(red, green, blue);
    }

    Color toAwt() {
        return new Color(red, green, blue);
    }
}
