package uk.gegc.lessondocs.features.document.application.layout;

/**
 * Tinted box with a colored left border.
 */
public record CalloutPalette(RgbColor background, RgbColor border) {

    public static CalloutPalette of(int bgR, int bgG, int bgB, int borderR, int borderG, int borderB) {
        return new CalloutPalette(new RgbColor(bgR, bgG, bgB), new RgbColor(borderR, borderG, borderB));
    }
}
